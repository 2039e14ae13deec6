/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.app;

import com.intuitivedesigns.logshipper.codec.DecodeException;
import com.intuitivedesigns.logshipper.core.EventSink;
import com.intuitivedesigns.logshipper.listener.DatagramListener;
import com.intuitivedesigns.logshipper.sink.AbstractBackloggedSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Periodic one-line summary of intake rate and per-sink health.
 */
final class StatsReporter implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StatsReporter.class);

    private final Shipper shipper;
    private final LongSupplier nanoClock;

    private long lastTimeNs;
    private long lastReceived;

    StatsReporter(Shipper shipper, LongSupplier nanoClock) {
        this.shipper = Objects.requireNonNull(shipper, "shipper");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.lastTimeNs = nanoClock.getAsLong();
    }

    @Override
    public void run() {
        try {
            log.info(summary());
        } catch (RuntimeException e) {
            log.warn("Stats reporter error", e);
        }
    }

    String summary() {
        final long nowNs = nanoClock.getAsLong();
        final double seconds = Math.max(1e-9, (nowNs - lastTimeNs) / 1_000_000_000.0);

        long received = 0;
        long badCategory = 0;
        long badPayload = 0;
        for (DatagramListener l : shipper.listeners()) {
            received += l.receivedCount();
            badCategory += l.droppedCount(DecodeException.Kind.INVALID_CATEGORY);
            badPayload += l.droppedCount(DecodeException.Kind.INVALID_PAYLOAD);
        }
        final double eps = (received - lastReceived) / seconds;

        final StringBuilder sb = new StringBuilder(128);
        sb.append(String.format(Locale.US, "IN: %,.0f eps | RECEIVED: %,d | DROPPED: %,d bad-category %,d bad-payload",
                eps, received, badCategory, badPayload));

        for (EventSink sink : shipper.sinks()) {
            sb.append(" | ").append(sink.id()).append('=').append(sink.state())
                    .append(" backlog=").append(sink.backlogSize());
            if (sink instanceof AbstractBackloggedSink s) {
                sb.append(" sent=").append(s.sentCount())
                        .append(" evicted=").append(s.evictedCount());
            }
        }

        lastReceived = received;
        lastTimeNs = nowNs;
        return sb.toString();
    }
}
