/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.sink;

import com.intuitivedesigns.logshipper.config.ShipperConfig;
import com.intuitivedesigns.logshipper.core.LogEvent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BacklogTest {

    private static LogEvent event(int n) {
        return LogEvent.of("test", Map.of("n", n));
    }

    private static List<Object> numbers(Backlog backlog) {
        return backlog.events().stream().map(e -> e.fields().get("n")).toList();
    }

    @Test
    void testSizeNeverExceedsCapacityAndOldestIsEvicted() {
        Backlog backlog = new Backlog(3, OverflowPolicy.DROP_OLDEST);

        for (int i = 1; i <= 10; i++) {
            backlog.offer(event(i), i);
            assertTrue(backlog.size() <= 3);
        }

        assertEquals(List.of(8, 9, 10), numbers(backlog));
        assertEquals(7, backlog.evictedCount());
        assertEquals(8L, backlog.oldestEnqueuedNanos().getAsLong());
    }

    @Test
    void testDropNewestKeepsExistingEntries() {
        Backlog backlog = new Backlog(2, OverflowPolicy.DROP_NEWEST);

        assertTrue(backlog.offer(event(1), 0));
        assertTrue(backlog.offer(event(2), 0));
        assertFalse(backlog.offer(event(3), 0));

        assertEquals(List.of(1, 2), numbers(backlog));
        assertEquals(1, backlog.evictedCount());
    }

    @Test
    void testPeekDoesNotRemove() {
        Backlog backlog = new Backlog(5, OverflowPolicy.DROP_OLDEST);
        for (int i = 1; i <= 4; i++) backlog.offer(event(i), 0);

        List<BacklogEntry> head = backlog.peek(2);

        assertEquals(2, head.size());
        assertEquals(1, head.get(0).event().fields().get("n"));
        assertEquals(4, backlog.size());
        assertTrue(backlog.peek(0).isEmpty());
    }

    @Test
    void testRemoveAllSkipsEntriesEvictedWhileInFlight() {
        Backlog backlog = new Backlog(3, OverflowPolicy.DROP_OLDEST);
        for (int i = 1; i <= 3; i++) backlog.offer(event(i), 0);

        List<BacklogEntry> inFlight = backlog.peek(2);   // 1, 2
        backlog.offer(event(4), 0);                       // evicts 1

        assertEquals(1, backlog.removeAll(inFlight));     // only 2 was still queued
        assertEquals(List.of(3, 4), numbers(backlog));
    }

    @Test
    void testRemoveAllUsesIdentityNotEquality() {
        Backlog backlog = new Backlog(3, OverflowPolicy.DROP_OLDEST);
        LogEvent same = event(1);
        backlog.offer(same, 0);
        backlog.offer(same, 0);

        List<BacklogEntry> first = backlog.peek(1);
        assertEquals(1, backlog.removeAll(first));
        assertEquals(1, backlog.size());
    }

    @Test
    void testRecordFailureExpiresEntriesAtCeiling() {
        Backlog backlog = new Backlog(5, OverflowPolicy.DROP_OLDEST);
        backlog.offer(event(1), 0);
        backlog.offer(event(2), 0);

        List<BacklogEntry> batch = backlog.peek(1);
        assertEquals(0, backlog.recordFailure(batch, 2));
        assertEquals(1, batch.get(0).attempts());
        assertEquals(1, backlog.recordFailure(batch, 2));

        assertEquals(List.of(2), numbers(backlog));
    }

    @Test
    void testRecordFailureWithoutCeilingKeepsEntries() {
        Backlog backlog = new Backlog(5, OverflowPolicy.DROP_OLDEST);
        backlog.offer(event(1), 0);
        List<BacklogEntry> batch = backlog.peek(1);

        for (int i = 0; i < 100; i++) {
            assertEquals(0, backlog.recordFailure(batch, 0));
        }
        assertEquals(1, backlog.size());
        assertEquals(100, batch.get(0).attempts());
    }

    @Test
    void testCapacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new Backlog(0, OverflowPolicy.DROP_OLDEST));
    }

    @Test
    void testOverflowPolicyParsing() {
        assertEquals(OverflowPolicy.DROP_OLDEST, OverflowPolicy.parse(null, OverflowPolicy.DROP_OLDEST));
        assertEquals(OverflowPolicy.DROP_NEWEST, OverflowPolicy.parse(" drop-newest ", OverflowPolicy.DROP_OLDEST));
        assertThrows(IllegalArgumentException.class, () -> OverflowPolicy.parse("random", OverflowPolicy.DROP_OLDEST));
    }

    @Test
    void testFromConfigPerSinkOverride() {
        ShipperConfig config = ShipperConfig.fromMap(Map.of(
                "backlog.capacity", "100",
                "rpc.backlog.capacity", "10",
                "backlog.overflow.policy", "DROP_NEWEST"));

        Backlog rpc = Backlog.fromConfig(config, "rpc");
        Backlog amqp = Backlog.fromConfig(config, "amqp");

        assertEquals(10, rpc.capacity());
        assertEquals(100, amqp.capacity());
        assertEquals(OverflowPolicy.DROP_NEWEST, amqp.policy());
        assertEquals(Backlog.DEFAULT_CAPACITY, Backlog.fromConfig(ShipperConfig.fromMap(Map.of()), "x").capacity());
    }
}
