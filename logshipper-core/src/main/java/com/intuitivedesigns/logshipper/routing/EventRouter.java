/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.routing;

import com.intuitivedesigns.logshipper.core.EventSink;
import com.intuitivedesigns.logshipper.core.LogEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Fans every accepted event out to all configured sinks.
 *
 * <p>The sink list is fixed at construction. A sink's state does not matter
 * here: a sink in backoff still receives the event into its backlog. One
 * misbehaving sink never prevents delivery to the others.</p>
 */
public final class EventRouter {

    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    private static final long ERROR_LOG_INTERVAL_MS = 5_000L;

    private final List<EventSink> sinks;

    private final LongAdder routed = new LongAdder();
    private final LongAdder sinkErrors = new LongAdder();

    private final AtomicLong lastErrorLogMs = new AtomicLong(0);
    private final LongAdder suppressedErrorLogs = new LongAdder();

    public EventRouter(List<? extends EventSink> sinks) {
        this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
    }

    public void accept(LogEvent event) {
        if (event == null) return;
        routed.increment();

        for (EventSink sink : sinks) {
            try {
                sink.offer(event);
            } catch (RuntimeException e) {
                sinkErrors.increment();
                logRateLimited(sink.id(), e);
            }
        }
    }

    public List<EventSink> sinks() {
        return sinks;
    }

    public long routedCount() {
        return routed.sum();
    }

    public long sinkErrorCount() {
        return sinkErrors.sum();
    }

    private void logRateLimited(String sinkId, RuntimeException e) {
        final long now = System.currentTimeMillis();
        final long last = lastErrorLogMs.get();

        if (now - last >= ERROR_LOG_INTERVAL_MS && lastErrorLogMs.compareAndSet(last, now)) {
            final long suppressed = suppressedErrorLogs.sumThenReset();
            log.error("Sink '{}' rejected an event (suppressed {} similar errors)", sinkId, suppressed, e);
        } else {
            suppressedErrorLogs.increment();
        }
    }
}
