/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.routing;

import com.intuitivedesigns.logshipper.core.LogEvent;
import com.intuitivedesigns.logshipper.core.SinkState;
import com.intuitivedesigns.logshipper.testing.RecordingSink;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventRouterTest {

    private static LogEvent event(int n) {
        return LogEvent.of("test", Map.of("n", n));
    }

    @Test
    void testDeliversToEverySinkExactlyOnceEvenInBackoff() {
        RecordingSink connected = new RecordingSink("connected");
        RecordingSink backingOff = new RecordingSink("backoff", SinkState.backoff(3, 0L));
        RecordingSink disconnected = new RecordingSink("disconnected", SinkState.disconnected(0L));
        EventRouter router = new EventRouter(List.of(connected, backingOff, disconnected));

        LogEvent e = event(1);
        router.accept(e);

        for (RecordingSink sink : List.of(connected, backingOff, disconnected)) {
            assertEquals(1, sink.offered().size(), sink.id());
            assertSame(e, sink.offered().get(0));
        }
        assertEquals(1, router.routedCount());
    }

    @Test
    void testFailingSinkDoesNotAffectOthers() {
        RecordingSink broken = new RecordingSink("broken") {
            @Override
            public void offer(LogEvent event) {
                throw new IllegalStateException("boom");
            }
        };
        RecordingSink healthy = new RecordingSink("healthy");
        EventRouter router = new EventRouter(List.of(broken, healthy));

        router.accept(event(1));
        router.accept(event(2));

        assertEquals(2, healthy.offered().size());
        assertEquals(2, router.sinkErrorCount());
    }

    @Test
    void testPerSinkOrderFollowsArrival() {
        RecordingSink sink = new RecordingSink("ordered");
        EventRouter router = new EventRouter(List.of(sink));

        for (int i = 0; i < 50; i++) {
            router.accept(event(i));
        }

        List<Object> seen = new ArrayList<>();
        sink.offered().forEach(e -> seen.add(e.fields().get("n")));
        for (int i = 0; i < 50; i++) {
            assertEquals(i, seen.get(i));
        }
    }

    @Test
    void testSinkListIsFixedAtConstruction() {
        List<RecordingSink> sinks = new ArrayList<>(List.of(new RecordingSink("a")));
        EventRouter router = new EventRouter(sinks);

        sinks.add(new RecordingSink("b"));

        assertEquals(1, router.sinks().size());
        assertThrows(UnsupportedOperationException.class, () -> router.sinks().clear());
    }

    @Test
    void testNullEventIsIgnored() {
        RecordingSink sink = new RecordingSink("a");
        new EventRouter(List.of(sink)).accept(null);
        assertTrue(sink.offered().isEmpty());
    }
}
