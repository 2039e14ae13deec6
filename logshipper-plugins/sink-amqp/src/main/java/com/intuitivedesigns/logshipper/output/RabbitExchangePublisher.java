/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.output;

import com.intuitivedesigns.logshipper.core.SinkException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * {@link ExchangePublisher} on the RabbitMQ Java client.
 *
 * <p>With publisher confirms on, every publish waits up to the confirm
 * timeout for the broker's ack; a nack or timeout fails the publish. With
 * confirms off a publish succeeds as soon as the frame is written, which
 * loses messages the broker drops.</p>
 */
public final class RabbitExchangePublisher implements ExchangePublisher {

    private static final Logger log = LoggerFactory.getLogger(RabbitExchangePublisher.class);

    private static final String CONTENT_TYPE = "application/json";
    private static final String CONNECTION_NAME = "logshipper";

    private final ConnectionFactory factory;
    private final String exchange;
    private final String exchangeType;
    private final boolean durable;
    private final boolean confirms;
    private final long confirmTimeoutMs;

    private volatile Connection connection;
    private volatile Channel channel;

    public RabbitExchangePublisher(ConnectionFactory factory,
                                   String exchange,
                                   String exchangeType,
                                   boolean durable,
                                   boolean confirms,
                                   long confirmTimeoutMs) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.exchangeType = Objects.requireNonNull(exchangeType, "exchangeType");
        this.durable = durable;
        this.confirms = confirms;
        this.confirmTimeoutMs = Math.max(1L, confirmTimeoutMs);

        // Reconnects are driven by the sink supervisor, not by the client library
        this.factory.setAutomaticRecoveryEnabled(false);
        this.factory.setTopologyRecoveryEnabled(false);
    }

    @Override
    public void open() throws SinkException {
        close();
        try {
            final Connection c = factory.newConnection(CONNECTION_NAME);
            this.connection = c;
            final Channel ch = c.createChannel();
            ch.exchangeDeclare(exchange, exchangeType, durable);
            if (confirms) {
                ch.confirmSelect();
            }
            this.channel = ch;
        } catch (IOException | TimeoutException | RuntimeException e) {
            close();
            throw SinkException.connect("AMQP connect to " + factory.getHost() + ":" + factory.getPort() + " failed", e);
        }
        log.info("AMQP channel open: exchange='{}' type={} durable={} confirms={}", exchange, exchangeType, durable, confirms);
    }

    @Override
    public void publish(String routingKey, byte[] body) throws SinkException {
        final Channel ch = channel;
        if (ch == null || !ch.isOpen()) {
            throw SinkException.send("AMQP channel is not open");
        }

        final AMQP.BasicProperties props = new AMQP.BasicProperties.Builder()
                .contentType(CONTENT_TYPE)
                .deliveryMode(1)
                .build();

        try {
            ch.basicPublish(exchange, routingKey, props, body);
            if (confirms) {
                ch.waitForConfirmsOrDie(confirmTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw SinkException.send("Interrupted while waiting for publisher confirm", e);
        } catch (IOException | TimeoutException | RuntimeException e) {
            throw SinkException.send("AMQP publish to exchange '" + exchange + "' failed", e);
        }
    }

    @Override
    public boolean confirmed() {
        return confirms;
    }

    @Override
    public void close() {
        final Channel ch = channel;
        final Connection c = connection;
        channel = null;
        connection = null;

        if (ch != null && ch.isOpen()) {
            try {
                ch.close();
            } catch (IOException | TimeoutException | RuntimeException e) {
                log.debug("Ignoring AMQP channel close failure: {}", e.toString());
            }
        }
        if (c != null && c.isOpen()) {
            try {
                c.close();
            } catch (IOException | RuntimeException e) {
                log.debug("Ignoring AMQP connection close failure: {}", e.toString());
            }
        }
    }
}
