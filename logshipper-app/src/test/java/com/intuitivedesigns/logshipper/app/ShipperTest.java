/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.app;

import com.intuitivedesigns.logshipper.codec.EventCodec;
import com.intuitivedesigns.logshipper.core.LogEvent;
import com.intuitivedesigns.logshipper.core.SinkState;
import com.intuitivedesigns.logshipper.listener.DatagramListener;
import com.intuitivedesigns.logshipper.metrics.MetricsRuntime;
import com.intuitivedesigns.logshipper.routing.EventRouter;
import com.intuitivedesigns.logshipper.sink.Backlog;
import com.intuitivedesigns.logshipper.sink.ConsoleSink;
import com.intuitivedesigns.logshipper.sink.OverflowPolicy;
import com.intuitivedesigns.logshipper.supervisor.BackoffSchedule;
import com.intuitivedesigns.logshipper.supervisor.SinkSupervisor;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShipperTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC);

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final EventCodec codec = new EventCodec();

    private Shipper shipper(InetSocketAddress bind) {
        ConsoleSink console = new ConsoleSink(new PrintStream(out, true, StandardCharsets.UTF_8), codec,
                new Backlog(100, OverflowPolicy.DROP_OLDEST), System::nanoTime, MetricsRuntime.NOOP);
        EventRouter router = new EventRouter(List.of(console));
        DatagramListener listener = new DatagramListener("udplog", bind, codec, router, CLOCK, MetricsRuntime.NOOP);
        SinkSupervisor supervisor = new SinkSupervisor(router.sinks(),
                new BackoffSchedule(Duration.ofMillis(10), Duration.ofMillis(100), 2.0, 4),
                Duration.ofMillis(10), System::nanoTime);
        return new Shipper(List.of(listener), router, supervisor, Duration.ofSeconds(1));
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testDatagramFlowsToConsole() throws Exception {
        Shipper shipper = shipper(new InetSocketAddress("127.0.0.1", 0));
        shipper.start();
        try {
            InetSocketAddress target = shipper.listeners().get(0).localAddress();
            byte[] datagram = "metrics: {\"value\": 1}".getBytes(StandardCharsets.UTF_8);
            try (DatagramSocket client = new DatagramSocket()) {
                client.send(new DatagramPacket(datagram, datagram.length, target));
            }

            long deadline = System.currentTimeMillis() + 5_000;
            while (!output().contains("metrics:") && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
        } finally {
            shipper.close();
        }

        LogEvent printed = codec.decode(output().trim().getBytes(StandardCharsets.UTF_8));
        assertEquals("metrics", printed.category());
        assertEquals(1, printed.fields().get("value"));
        assertEquals(CLOCK.millis() / 1000.0, printed.timestamp().getAsDouble(), 0.0);
        assertEquals(SinkState.Phase.DISCONNECTED, shipper.sinks().get(0).state().phase());
    }

    @Test
    void testBindFailureStopsEverythingStarted() throws Exception {
        try (DatagramSocket taken = new DatagramSocket(0, InetAddress.getByName("127.0.0.1"))) {
            Shipper shipper = shipper(new InetSocketAddress("127.0.0.1", taken.getLocalPort()));

            assertThrows(IOException.class, shipper::start);
            assertEquals(SinkState.Phase.DISCONNECTED, shipper.sinks().get(0).state().phase());
        }
    }

    @Test
    void testCloseIsIdempotent() throws Exception {
        Shipper shipper = shipper(new InetSocketAddress("127.0.0.1", 0));
        shipper.start();
        shipper.close();
        shipper.close();
    }
}
