/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.listener;

import com.intuitivedesigns.logshipper.codec.DecodeException;
import com.intuitivedesigns.logshipper.codec.EventCodec;
import com.intuitivedesigns.logshipper.core.LogEvent;
import com.intuitivedesigns.logshipper.metrics.MetricsRuntime;
import com.intuitivedesigns.logshipper.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.logshipper.routing.EventRouter;
import com.intuitivedesigns.logshipper.testing.RecordingSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DatagramListenerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30.250Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final RecordingSink first = new RecordingSink("first");
    private final RecordingSink second = new RecordingSink("second");
    private final EventRouter router = new EventRouter(List.of(first, second));
    private final MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();

    private DatagramListener listener;

    @AfterEach
    void tearDown() {
        if (listener != null) listener.stop();
        metrics.close();
    }

    private DatagramListener newListener(MetricsRuntime m) {
        return new DatagramListener("udplog", new InetSocketAddress("127.0.0.1", 0),
                new EventCodec(), router, CLOCK, m);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testMetricsDatagramGetsTimestampAndReachesEverySink() {
        listener = newListener(metrics);

        listener.handleDatagram(bytes("metrics: {\"value\": 1}"));

        assertEquals(1, first.offered().size());
        assertSame(first.offered().get(0), second.offered().get(0));

        LogEvent event = first.offered().get(0);
        assertEquals("metrics", event.category());
        assertEquals(1, event.fields().get("value"));
        assertEquals(NOW.toEpochMilli() / 1000.0, event.timestamp().getAsDouble(), 0.0);
        assertEquals(Map.of("value", 1, "timestamp", NOW.toEpochMilli() / 1000.0), event.fields());
    }

    @Test
    void testProvidedTimestampIsPreserved() {
        listener = newListener(metrics);

        listener.handleDatagram(bytes("app: {\"timestamp\": \"1379002018.000\"}"));
        listener.handleDatagram(bytes("app: {\"timestamp\": 1379002018}"));

        assertEquals("1379002018.000", first.offered().get(0).fields().get("timestamp"));
        assertEquals(1379002018, first.offered().get(1).fields().get("timestamp"));
    }

    @Test
    void testBadCategoryIsCountedAndDropped() {
        listener = newListener(metrics);

        listener.handleDatagram(bytes("bad-cat: {}"));

        assertEquals(1, listener.droppedCount(DecodeException.Kind.INVALID_CATEGORY));
        assertEquals(0, listener.droppedCount(DecodeException.Kind.INVALID_PAYLOAD));
        assertTrue(first.offered().isEmpty());
        assertTrue(second.offered().isEmpty());

        double counted = metrics.registry()
                .get("logshipper_datagrams_dropped_total")
                .tag("reason", "invalid_category")
                .counter()
                .count();
        assertEquals(1.0, counted);
    }

    @Test
    void testBadPayloadIsCountedAndDropped() {
        listener = newListener(MetricsRuntime.NOOP);

        listener.handleDatagram(bytes("cat: [1, 2, 3]"));
        listener.handleDatagram(bytes("cat: {"));

        assertEquals(2, listener.droppedCount(DecodeException.Kind.INVALID_PAYLOAD));
        assertEquals(2, listener.receivedCount());
        assertEquals(0, listener.acceptedCount());
        assertTrue(first.offered().isEmpty());
    }

    @Test
    void testReceivesOverUdp() throws Exception {
        listener = newListener(metrics);
        listener.start();
        InetSocketAddress target = listener.localAddress();
        assertNotEquals(0, target.getPort());

        try (DatagramSocket client = new DatagramSocket()) {
            byte[] ok = bytes("orders: {\"id\": 7}\n");
            byte[] bad = bytes("not a log line");
            client.send(new DatagramPacket(bad, bad.length, target));
            client.send(new DatagramPacket(ok, ok.length, target));
        }

        long deadline = System.currentTimeMillis() + 5_000;
        while (first.offered().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertEquals(1, first.offered().size());
        assertEquals("orders", first.offered().get(0).category());
        assertEquals(7, first.offered().get(0).fields().get("id"));
        assertEquals(1, listener.droppedCount(DecodeException.Kind.INVALID_CATEGORY));
    }

    @Test
    void testBindFailureIsFatal() throws Exception {
        listener = newListener(metrics);
        listener.start();

        DatagramListener clash = new DatagramListener("clash", listener.localAddress(),
                new EventCodec(), router, CLOCK, MetricsRuntime.NOOP);

        assertThrows(IOException.class, clash::start);
    }

    @Test
    void testStopIsIdempotent() throws Exception {
        listener = newListener(metrics);
        listener.start();
        listener.stop();
        listener.stop();
    }
}
