/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.app;

import com.intuitivedesigns.logshipper.config.ShipperConfig;
import com.intuitivedesigns.logshipper.core.EventSink;
import com.intuitivedesigns.logshipper.core.SinkState;
import com.intuitivedesigns.logshipper.listener.DatagramListener;
import com.intuitivedesigns.logshipper.metrics.MetricsRuntime;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ShipperFactoryTest {

    private static Shipper create(Map<String, String> values) {
        return ShipperFactory.create(ShipperConfig.fromMap(values), MetricsRuntime.NOOP);
    }

    @Test
    void testNoSinksConfigured() {
        Shipper shipper = create(Map.of());

        assertTrue(shipper.sinks().isEmpty());
        assertEquals(1, shipper.listeners().size());
        assertEquals(ShipperFactory.UDPLOG_LISTENER, shipper.listeners().get(0).name());
    }

    @Test
    void testEverySinkWiredInFixedOrder() {
        Map<String, String> values = new HashMap<>();
        values.put("amqp.host", "127.0.0.1");
        values.put("rpc.url", "http://127.0.0.1:1/log");
        values.put("kafka.bootstrap.servers", "127.0.0.1:1");
        values.put("redis.hosts", "127.0.0.1:1");
        values.put("verbose", "true");

        Shipper shipper = create(values);

        List<String> ids = shipper.sinks().stream().map(EventSink::id).toList();
        assertEquals(List.of("amqp", "rpc", "kafka", "redis", "console"), ids);
        for (EventSink sink : shipper.sinks()) {
            assertEquals(SinkState.Phase.DISCONNECTED, sink.state().phase());
        }
        assertSame(shipper.sinks(), shipper.router().sinks());
    }

    @Test
    void testSyslogListenerIsOptIn() {
        Shipper shipper = create(Map.of("syslog.port", "0", "listen.port", "0"));

        List<String> names = shipper.listeners().stream().map(DatagramListener::name).toList();
        assertEquals(List.of(ShipperFactory.UDPLOG_LISTENER, ShipperFactory.SYSLOG_LISTENER), names);
    }

    @Test
    void testInvalidSettingsFailBeforeWiring() {
        assertThrows(IllegalArgumentException.class, () -> create(Map.of("backlog.capacity", "0", "verbose", "true")));
        assertThrows(IllegalArgumentException.class, () -> create(Map.of("rpc.url", "http://x/log", "rpc.min.log.level", "LOUD")));
    }
}
