/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.sink;

import com.intuitivedesigns.logshipper.core.LogEvent;

/**
 * One queued event plus its delivery bookkeeping. Identity matters: the
 * backlog removes delivered entries by reference, not by value.
 */
public final class BacklogEntry {

    private final LogEvent event;
    private final long enqueuedAtNanos;

    // Written under the owning Backlog's lock
    private volatile int attempts;

    BacklogEntry(LogEvent event, long enqueuedAtNanos) {
        this.event = event;
        this.enqueuedAtNanos = enqueuedAtNanos;
    }

    public LogEvent event() {
        return event;
    }

    public long enqueuedAtNanos() {
        return enqueuedAtNanos;
    }

    /**
     * Failed delivery attempts so far.
     */
    public int attempts() {
        return attempts;
    }

    void recordAttempt() {
        attempts++;
    }

    @Override
    public String toString() {
        return "BacklogEntry{" + event.category() + ", attempts=" + attempts + '}';
    }
}
