/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.supervisor;

import com.intuitivedesigns.logshipper.core.SinkState;
import com.intuitivedesigns.logshipper.testing.RecordingSink;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SinkSupervisorTest {

    private static final long SECOND = TimeUnit.SECONDS.toNanos(1);

    private final BackoffSchedule schedule = new BackoffSchedule(
            Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 16);

    private SinkSupervisor supervisor(RecordingSink... sinks) {
        return new SinkSupervisor(List.of(sinks), schedule, Duration.ofMillis(100), System::nanoTime);
    }

    @Test
    void testDisconnectedSinkIsConnectedImmediately() {
        RecordingSink sink = new RecordingSink("a", SinkState.disconnected(0L));

        assertEquals(1, supervisor(sink).checkOnce(0L));
        assertEquals(1, sink.connectRequests());
    }

    @Test
    void testConnectedAndConnectingSinksAreLeftAlone() {
        RecordingSink connected = new RecordingSink("a", SinkState.connected(0L));
        RecordingSink connecting = new RecordingSink("b", SinkState.connecting(2, 0L));

        assertEquals(0, supervisor(connected, connecting).checkOnce(100 * SECOND));
        assertEquals(0, connected.connectRequests());
        assertEquals(0, connecting.connectRequests());
    }

    @Test
    void testBackoffWaitsForItsDelay() {
        long since = 50 * SECOND;
        RecordingSink sink = new RecordingSink("a", SinkState.backoff(3, since));   // delay 4s
        SinkSupervisor supervisor = supervisor(sink);

        supervisor.checkOnce(since + 3 * SECOND);
        assertEquals(0, sink.connectRequests());

        supervisor.checkOnce(since + 4 * SECOND);
        assertEquals(1, sink.connectRequests());
    }

    @Test
    void testLongerBackoffWaitsLonger() {
        SinkSupervisor supervisor = supervisor();

        assertTrue(supervisor.isDue(SinkState.backoff(1, 0L), SECOND));
        assertFalse(supervisor.isDue(SinkState.backoff(2, 0L), SECOND));
        assertTrue(supervisor.isDue(SinkState.backoff(2, 0L), 2 * SECOND));
        assertFalse(supervisor.isDue(SinkState.backoff(10, 0L), 29 * SECOND));
        assertTrue(supervisor.isDue(SinkState.backoff(10, 0L), 30 * SECOND));
    }

    @Test
    void testScheduledTicksRequestConnects() throws Exception {
        RecordingSink sink = new RecordingSink("a", SinkState.disconnected(0L));
        SinkSupervisor supervisor = supervisor(sink);
        supervisor.start();
        try {
            long deadline = System.currentTimeMillis() + 5_000;
            while (sink.connectRequests() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertTrue(sink.connectRequests() >= 2);
        } finally {
            supervisor.stop();
        }
    }
}
