/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.supervisor;

import com.intuitivedesigns.logshipper.concurrent.NamedDaemonThreadFactory;
import com.intuitivedesigns.logshipper.core.EventSink;
import com.intuitivedesigns.logshipper.core.SinkState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Decides when each sink tries to reconnect.
 *
 * <p>Every tick looks at each sink's state: a {@code Disconnected} sink is
 * asked to connect right away, a sink in {@code Backoff(n)} once
 * {@code delay(n)} has passed since it entered that state. The connect itself
 * runs on the sink's worker. The supervisor holds no events and sends nothing.</p>
 */
public final class SinkSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SinkSupervisor.class);

    private final List<EventSink> sinks;
    private final BackoffSchedule schedule;
    private final Duration tick;
    private final LongSupplier nanoClock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledExecutorService scheduler;

    public SinkSupervisor(List<? extends EventSink> sinks,
                          BackoffSchedule schedule,
                          Duration tick,
                          LongSupplier nanoClock) {
        this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.tick = Objects.requireNonNull(tick, "tick");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        if (tick.isNegative() || tick.isZero()) throw new IllegalArgumentException("Supervisor tick must be > 0");
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;

        final ScheduledExecutorService s = Executors.newSingleThreadScheduledExecutor(
                new NamedDaemonThreadFactory("sink-supervisor"));
        this.scheduler = s;

        final long periodMs = Math.max(1L, tick.toMillis());
        s.scheduleWithFixedDelay(this::tickSafely, 0L, periodMs, TimeUnit.MILLISECONDS);
        log.info("Supervisor watching {} sink(s): tick={}ms {}", sinks.size(), periodMs, schedule);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) return;
        final ScheduledExecutorService s = scheduler;
        if (s != null) {
            s.shutdownNow();
            try {
                s.awaitTermination(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Supervisor stopped.");
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * One supervision pass.
     *
     * @return number of sinks asked to connect
     */
    public int checkOnce(long nowNanos) {
        int requested = 0;
        for (EventSink sink : sinks) {
            if (isDue(sink.state(), nowNanos)) {
                sink.requestConnect();
                requested++;
            }
        }
        return requested;
    }

    boolean isDue(SinkState state, long nowNanos) {
        return switch (state.phase()) {
            case DISCONNECTED -> true;
            case BACKOFF -> nowNanos - state.sinceNanos() >= schedule.delayNanos(state.attempt());
            case CONNECTING, CONNECTED -> false;
        };
    }

    private void tickSafely() {
        try {
            checkOnce(nanoClock.getAsLong());
        } catch (RuntimeException e) {
            log.error("Supervisor tick failed", e);
        }
    }
}
