/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.output;

import com.intuitivedesigns.logshipper.core.SinkException;
import com.rabbitmq.client.ConnectionFactory;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;

import static org.junit.jupiter.api.Assertions.*;

class RabbitExchangePublisherTest {

    private static int closedPort() throws Exception {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }

    @Test
    void testOpenAgainstDeadBrokerFailsWithConnectKind() throws Exception {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost("127.0.0.1");
        factory.setPort(closedPort());
        factory.setConnectionTimeout(1_000);

        RabbitExchangePublisher publisher = new RabbitExchangePublisher(factory, "logs", "topic", true, true, 1_000L);

        SinkException e = assertThrows(SinkException.class, publisher::open);
        assertEquals(SinkException.Kind.CONNECT, e.kind());
        assertTrue(publisher.confirmed());

        publisher.close();
    }

    @Test
    void testPublishWithoutOpenIsASendFailure() {
        RabbitExchangePublisher publisher = new RabbitExchangePublisher(
                new ConnectionFactory(), "logs", "topic", true, false, 1_000L);

        SinkException e = assertThrows(SinkException.class, () -> publisher.publish("app", new byte[0]));
        assertEquals(SinkException.Kind.SEND, e.kind());
        assertFalse(publisher.confirmed());
    }
}
