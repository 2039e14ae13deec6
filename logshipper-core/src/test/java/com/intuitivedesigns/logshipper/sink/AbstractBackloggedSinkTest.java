/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.sink;

import com.intuitivedesigns.logshipper.core.LogEvent;
import com.intuitivedesigns.logshipper.core.SinkState;
import com.intuitivedesigns.logshipper.metrics.MicrometerMetricsRuntime;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class AbstractBackloggedSinkTest {

    private final AtomicLong clock = new AtomicLong(1_000L);

    private ScriptedSink sink(int capacity, int maxAttempts) {
        return new ScriptedSink(new Backlog(capacity, OverflowPolicy.DROP_OLDEST), maxAttempts, clock::get);
    }

    private static LogEvent event(int n) {
        return LogEvent.of("test", Map.of("n", n));
    }

    private static List<Object> numbers(List<LogEvent> events) {
        return events.stream().map(e -> e.fields().get("n")).toList();
    }

    @Test
    void testInitialStateIsDisconnected() {
        assertEquals(SinkState.Phase.DISCONNECTED, sink(3, 0).state().phase());
    }

    @Test
    void testConnectFailureGoesToBackoffOneThenCounts() {
        ScriptedSink sink = sink(3, 0);
        sink.failConnect = true;

        sink.connect();
        assertEquals(SinkState.backoff(1, clock.get()), sink.state());

        clock.addAndGet(10);
        sink.connect();
        sink.connect();
        assertEquals(SinkState.Phase.BACKOFF, sink.state().phase());
        assertEquals(3, sink.state().attempt());
        assertEquals(clock.get(), sink.state().sinceNanos());
        assertEquals(3, sink.connectFailureCount());
    }

    @Test
    void testConnectAloneDoesNotResetBackoff() {
        ScriptedSink sink = sink(3, 0);
        sink.failConnect = true;
        sink.connect();
        sink.connect();

        sink.failConnect = false;
        sink.connect();
        assertTrue(sink.state().isConnected());
        assertEquals(0, sink.state().attempt());

        // Nothing was delivered yet, so the failure streak continues
        sink.failSend = true;
        sink.offer(event(1));
        sink.drain();
        assertEquals(SinkState.Phase.BACKOFF, sink.state().phase());
        assertEquals(3, sink.state().attempt());
    }

    @Test
    void testSuccessfulSendResetsBackoff() {
        ScriptedSink sink = sink(3, 0);
        sink.failConnect = true;
        sink.connect();
        sink.connect();

        sink.failConnect = false;
        sink.offer(event(1));
        sink.connect();
        assertEquals(List.of(1), numbers(sink.delivered()));

        sink.failSend = true;
        sink.offer(event(2));
        sink.drain();
        assertEquals(SinkState.backoff(1, clock.get()), sink.state());
    }

    @Test
    void testRepeatedSendFailuresEscalateBackoff() {
        ScriptedSink sink = sink(10, 0);
        sink.failSend = true;
        sink.offer(event(1));

        for (int expected = 1; expected <= 4; expected++) {
            sink.connect();
            assertEquals(SinkState.backoff(expected, clock.get()), sink.state());
        }
        assertEquals(4, sink.failedSendCount());
        assertEquals(0, sink.connectFailureCount());
    }

    @Test
    void testOfferWhileDisconnectedBuffersWithDropOldest() {
        ScriptedSink sink = sink(3, 0);

        for (int i = 1; i <= 5; i++) {
            sink.offer(event(i));
        }

        assertEquals(3, sink.backlogSize());
        assertEquals(2, sink.evictedCount());
        assertTrue(sink.batches.isEmpty());

        sink.connect();

        assertEquals(List.of(3, 4, 5), numbers(sink.delivered()));
        assertEquals(0, sink.backlogSize());
        assertEquals(3, sink.sentCount());
    }

    @Test
    void testSendFailureKeepsBatchAndClosesConnection() {
        ScriptedSink sink = sink(10, 0);
        sink.connect();
        sink.failSend = true;

        sink.offer(event(1));
        sink.offer(event(2));
        sink.drain();

        assertEquals(SinkState.Phase.BACKOFF, sink.state().phase());
        assertEquals(1, sink.state().attempt());
        assertEquals(2, sink.backlogSize());
        assertEquals(1, sink.failedSendCount());
        assertEquals(1, sink.closes);

        sink.failSend = false;
        sink.connect();
        assertEquals(List.of(1, 2), numbers(sink.delivered()));
    }

    @Test
    void testRetryCeilingDropsEntries() {
        ScriptedSink sink = sink(10, 2);
        sink.batchSize = 1;
        sink.offer(event(1));
        sink.offer(event(2));

        sink.failSend = true;
        sink.connect();     // attempt 1 on event 1
        sink.connect();     // attempt 2 on event 1 -> dropped

        assertEquals(1, sink.expiredCount());
        assertEquals(1, sink.backlogSize());

        sink.failSend = false;
        sink.connect();
        assertEquals(List.of(2), numbers(sink.delivered()));
    }

    @Test
    void testBatchesRespectMaxBatchSize() {
        ScriptedSink sink = sink(10, 0);
        sink.batchSize = 2;
        for (int i = 1; i <= 5; i++) sink.offer(event(i));

        sink.connect();

        assertEquals(3, sink.batches.size());
        assertEquals(List.of(1, 2, 3, 4, 5), numbers(sink.delivered()));
    }

    @Test
    void testDisconnect() {
        ScriptedSink sink = sink(3, 0);
        sink.connect();
        sink.disconnect();

        assertEquals(SinkState.Phase.DISCONNECTED, sink.state().phase());
        assertEquals(1, sink.closes);
    }

    @Test
    void testShutdownFlushesThenDisconnects() {
        ScriptedSink sink = sink(10, 0);
        sink.offer(event(1));
        sink.offer(event(2));

        sink.shutdown(Duration.ofSeconds(1));

        assertEquals(List.of(1, 2), numbers(sink.delivered()));
        assertEquals(SinkState.Phase.DISCONNECTED, sink.state().phase());
    }

    @Test
    void testShutdownWithDeadBackendStillDisconnects() {
        ScriptedSink sink = sink(10, 0);
        sink.failConnect = true;
        sink.offer(event(1));

        sink.shutdown(Duration.ofMillis(100));

        assertEquals(SinkState.Phase.DISCONNECTED, sink.state().phase());
        assertEquals(1, sink.backlogSize());
    }

    @Test
    void testStartedWorkerDeliversAfterRequestConnect() throws Exception {
        ScriptedSink sink = new ScriptedSink(new Backlog(10, OverflowPolicy.DROP_OLDEST), 0, System::nanoTime);
        sink.start();
        try {
            sink.offer(event(1));
            sink.requestConnect();

            long deadline = System.currentTimeMillis() + 5_000;
            while (sink.sentCount() < 1 && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            assertEquals(1, sink.sentCount());

            // Connected: new offers are pushed by the worker without another connect
            sink.offer(event(2));
            deadline = System.currentTimeMillis() + 5_000;
            while (sink.sentCount() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            assertEquals(List.of(1, 2), numbers(sink.delivered()));
        } finally {
            sink.shutdown(Duration.ofSeconds(1));
        }
        assertEquals(SinkState.Phase.DISCONNECTED, sink.state().phase());
    }

    @Test
    void testMetersAreRegistered() {
        MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();
        ScriptedSink sink = new ScriptedSink(new Backlog(2, OverflowPolicy.DROP_OLDEST), 0, clock::get, metrics);

        sink.offer(event(1));
        sink.offer(event(2));
        sink.offer(event(3));

        assertEquals(1.0, metrics.registry().get("logshipper_sink_events_evicted_total")
                .tag("sink", "scripted").functionCounter().count());
        assertEquals(2.0, metrics.registry().get("logshipper_sink_backlog_size")
                .tag("sink", "scripted").gauge().value());
        metrics.close();
    }
}
