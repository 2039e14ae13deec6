/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.sink;

import com.intuitivedesigns.logshipper.config.ShipperConfig;
import com.intuitivedesigns.logshipper.core.LogEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;

/**
 * Bounded FIFO of events waiting for one sink.
 *
 * <p>{@code size() <= capacity()} holds at all times. When full, the
 * {@link OverflowPolicy} decides which event is lost; every loss is counted in
 * {@link #evictedCount()}.</p>
 *
 * <p>Internally synchronized: the listener thread offers while the sink's
 * worker peeks and removes. All operations are O(1) apart from the batch
 * operations, which are O(batch).</p>
 */
public final class Backlog {

    public static final String CFG_CAPACITY = "backlog.capacity";
    public static final String CFG_POLICY = "backlog.overflow.policy";
    public static final int DEFAULT_CAPACITY = 2_500;

    private final int capacity;
    private final OverflowPolicy policy;
    private final ArrayDeque<BacklogEntry> entries;
    private final LongAdder evicted = new LongAdder();

    public Backlog(int capacity, OverflowPolicy policy) {
        if (capacity <= 0) throw new IllegalArgumentException("Backlog capacity must be > 0");
        this.capacity = capacity;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.entries = new ArrayDeque<>(Math.min(capacity, 4_096));
    }

    /**
     * Backlog for one sink: {@code <sinkId>.backlog.capacity} overrides
     * {@code backlog.capacity}; the overflow policy is shared.
     */
    public static Backlog fromConfig(ShipperConfig config, String sinkId) {
        Objects.requireNonNull(config, "config");
        final int shared = config.getInt(CFG_CAPACITY, DEFAULT_CAPACITY);
        final int capacity = config.getInt(sinkId + "." + CFG_CAPACITY, shared);
        if (capacity <= 0) {
            throw new IllegalArgumentException("Backlog capacity for '" + sinkId + "' must be > 0, got " + capacity);
        }
        final OverflowPolicy policy = OverflowPolicy.parse(config.getString(CFG_POLICY, null), OverflowPolicy.DROP_OLDEST);
        return new Backlog(capacity, policy);
    }

    /**
     * Enqueue an event, applying the overflow policy when full.
     *
     * @return true if the event was queued
     */
    public synchronized boolean offer(LogEvent event, long nowNanos) {
        Objects.requireNonNull(event, "event");
        if (entries.size() >= capacity) {
            evicted.increment();
            if (policy == OverflowPolicy.DROP_NEWEST) {
                return false;
            }
            entries.pollFirst();
        }
        entries.addLast(new BacklogEntry(event, nowNanos));
        return true;
    }

    /**
     * Up to {@code max} entries from the head, oldest first. Nothing is removed.
     */
    public synchronized List<BacklogEntry> peek(int max) {
        final int n = Math.min(max, entries.size());
        if (n <= 0) return List.of();
        final List<BacklogEntry> out = new ArrayList<>(n);
        final Iterator<BacklogEntry> it = entries.iterator();
        for (int i = 0; i < n; i++) {
            out.add(it.next());
        }
        return out;
    }

    /**
     * Remove entries that were delivered. Entries evicted in the meantime are skipped.
     *
     * @return number of entries actually removed
     */
    public synchronized int removeAll(List<BacklogEntry> delivered) {
        if (delivered.isEmpty()) return 0;
        final Set<BacklogEntry> pending = identitySet(delivered);
        int removed = 0;
        final Iterator<BacklogEntry> it = entries.iterator();
        while (it.hasNext() && !pending.isEmpty()) {
            final BacklogEntry e = it.next();
            if (pending.remove(e)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Count one failed attempt on each entry; entries that reach
     * {@code maxAttempts} are removed. {@code maxAttempts <= 0} means no ceiling.
     *
     * @return number of entries removed because they hit the ceiling
     */
    public synchronized int recordFailure(List<BacklogEntry> failed, int maxAttempts) {
        if (failed.isEmpty()) return 0;
        final Set<BacklogEntry> expired = Collections.newSetFromMap(new IdentityHashMap<>());
        for (BacklogEntry e : failed) {
            e.recordAttempt();
            if (maxAttempts > 0 && e.attempts() >= maxAttempts) {
                expired.add(e);
            }
        }
        if (expired.isEmpty()) return 0;
        int removed = 0;
        final Iterator<BacklogEntry> it = entries.iterator();
        while (it.hasNext() && removed < expired.size()) {
            if (expired.contains(it.next())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Enqueue time of the head entry, if any.
     */
    public synchronized OptionalLong oldestEnqueuedNanos() {
        final BacklogEntry head = entries.peekFirst();
        return (head == null) ? OptionalLong.empty() : OptionalLong.of(head.enqueuedAtNanos());
    }

    public synchronized List<LogEvent> events() {
        final List<LogEvent> out = new ArrayList<>(entries.size());
        for (BacklogEntry e : entries) {
            out.add(e.event());
        }
        return out;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    public OverflowPolicy policy() {
        return policy;
    }

    public long evictedCount() {
        return evicted.sum();
    }

    private static Set<BacklogEntry> identitySet(List<BacklogEntry> items) {
        final Set<BacklogEntry> set = Collections.newSetFromMap(new IdentityHashMap<>());
        set.addAll(items);
        return set;
    }
}
