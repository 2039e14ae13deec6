/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.testing;

import com.intuitivedesigns.logshipper.core.EventSink;
import com.intuitivedesigns.logshipper.core.LogEvent;
import com.intuitivedesigns.logshipper.core.SinkState;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sink double that records offers and connect requests.
 */
public class RecordingSink implements EventSink {

    private final String id;
    private final List<LogEvent> offered = new CopyOnWriteArrayList<>();
    private final AtomicInteger connectRequests = new AtomicInteger();
    private volatile SinkState state;

    public RecordingSink(String id) {
        this(id, SinkState.connected(0L));
    }

    public RecordingSink(String id, SinkState initial) {
        this.id = id;
        this.state = initial;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void offer(LogEvent event) {
        offered.add(event);
    }

    @Override
    public SinkState state() {
        return state;
    }

    public void setState(SinkState state) {
        this.state = state;
    }

    @Override
    public void connect() {
        state = SinkState.connected(0L);
    }

    @Override
    public void disconnect() {
        state = SinkState.disconnected(0L);
    }

    @Override
    public void requestConnect() {
        connectRequests.incrementAndGet();
    }

    @Override
    public void shutdown(Duration timeout) {
        disconnect();
    }

    public List<LogEvent> offered() {
        return offered;
    }

    public int connectRequests() {
        return connectRequests.get();
    }
}
