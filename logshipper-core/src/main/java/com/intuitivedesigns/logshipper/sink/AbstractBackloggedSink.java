/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.sink;

import com.intuitivedesigns.logshipper.concurrent.NamedDaemonThreadFactory;
import com.intuitivedesigns.logshipper.core.EventSink;
import com.intuitivedesigns.logshipper.core.LogEvent;
import com.intuitivedesigns.logshipper.core.SinkState;
import com.intuitivedesigns.logshipper.metrics.MetricsRuntime;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongSupplier;

/**
 * Base for sinks that buffer events and deliver them over a connection that
 * can come and go.
 *
 * <h2>State machine</h2>
 * <pre>
 * Disconnected --connect ok--&gt; Connected
 * Disconnected --connect fails--&gt; Backoff(f+1)
 * Backoff(n)   --connect ok--&gt; Connected
 * Backoff(n)   --connect fails--&gt; Backoff(f+1)
 * Connected    --send ok--&gt; Connected       (f reset to 0)
 * Connected    --send fails--&gt; Backoff(f+1)  (connection closed)
 * any          --disconnect--&gt; Disconnected
 * </pre>
 *
 * <p>{@code f} is the number of consecutive failures, connect or send. Only a
 * successful send resets it: a backend that accepts the connection but
 * rejects every batch keeps climbing the backoff schedule.</p>
 *
 * <p>The supervisor decides <em>when</em> to call {@link #requestConnect()};
 * this class decides what a connect or send outcome does to the state.
 * Connect, drain and flush run on the sink's single worker thread once
 * {@link #start()} was called; the same methods may be called directly
 * (tests do) and are serialized on an internal lock.</p>
 *
 * <p>A failed send leaves the batch in the backlog and counts one attempt
 * on each entry. With a retry ceiling, entries that failed that often are
 * dropped and counted as expired.</p>
 */
public abstract class AbstractBackloggedSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(AbstractBackloggedSink.class);

    private static final long ERROR_LOG_INTERVAL_MS = 5_000L;
    private static final int DEFAULT_MAX_BATCH_SIZE = 500;

    private final String id;
    private final Backlog backlog;
    private final int maxAttempts;
    private final LongSupplier nanoClock;

    // Guards connect/drain/disconnect and the subclass connection
    private final Object lock = new Object();
    private volatile SinkState state;
    private int consecutiveFailures;

    // Worker
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicBoolean connectPending = new AtomicBoolean(false);
    private final AtomicBoolean drainPending = new AtomicBoolean(false);
    private volatile ScheduledExecutorService worker;

    // Fast counters (always on)
    private final LongAdder accepted = new LongAdder();
    private final LongAdder filtered = new LongAdder();
    private final LongAdder sent = new LongAdder();
    private final LongAdder failedSends = new LongAdder();
    private final LongAdder expired = new LongAdder();
    private final LongAdder connectFailures = new LongAdder();

    // Rate-limited error logging
    private final AtomicLong lastErrorLogMs = new AtomicLong(0);
    private final LongAdder suppressedErrorLogs = new LongAdder();

    protected AbstractBackloggedSink(String id,
                                     Backlog backlog,
                                     int maxAttempts,
                                     LongSupplier nanoClock,
                                     MetricsRuntime metrics) {
        this.id = Objects.requireNonNull(id, "id");
        this.backlog = Objects.requireNonNull(backlog, "backlog");
        this.maxAttempts = Math.max(0, maxAttempts);
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.state = SinkState.disconnected(nanoClock.getAsLong());

        if (metrics != null && metrics.enabled() && metrics.registry() instanceof MeterRegistry mr) {
            registerMeters(mr);
        }
    }

    // ---- Subclass contract ----

    /**
     * Establish the backend connection. Throwing moves the sink into backoff.
     */
    protected abstract void openConnection() throws Exception;

    /**
     * Deliver a batch, oldest first. Returns normally only when the backend took all of it.
     */
    protected abstract void send(List<LogEvent> batch) throws Exception;

    /**
     * Release the backend connection. Called after send failures and on disconnect.
     */
    protected abstract void closeConnection() throws Exception;

    /**
     * Largest batch handed to {@link #send(List)}.
     */
    protected int maxBatchSize() {
        return DEFAULT_MAX_BATCH_SIZE;
    }

    /**
     * Whether a non-empty backlog should be sent now. Batching sinks hold
     * back until their size or age threshold is reached.
     */
    protected boolean readyToFlush(Backlog backlog, long nowNanos) {
        return true;
    }

    /**
     * Period of the worker's housekeeping tick, or zero for none.
     */
    protected Duration tickInterval() {
        return Duration.ZERO;
    }

    /**
     * Events this sink does not ship at all; they never enter the backlog.
     */
    protected boolean accepts(LogEvent event) {
        return true;
    }

    // ---- EventSink ----

    @Override
    public final String id() {
        return id;
    }

    @Override
    public SinkState state() {
        return state;
    }

    @Override
    public void offer(LogEvent event) {
        if (event == null) return;
        if (!accepts(event)) {
            filtered.increment();
            return;
        }
        accepted.increment();
        backlog.offer(event, nanoClock.getAsLong());
        if (state.isConnected()) {
            scheduleDrain();
        }
    }

    @Override
    public void connect() {
        synchronized (lock) {
            if (!connectLocked()) return;
            drainLocked(false, false, 0L);
        }
    }

    /**
     * Send whatever is ready. No-op unless connected.
     */
    public void drain() {
        synchronized (lock) {
            drainLocked(false, false, 0L);
        }
    }

    @Override
    public void disconnect() {
        synchronized (lock) {
            closeConnectionQuietly();
            state = SinkState.disconnected(now());
        }
    }

    @Override
    public void requestConnect() {
        final ScheduledExecutorService w = worker;
        if (w == null || stopping.get()) return;
        if (!connectPending.compareAndSet(false, true)) return;
        try {
            w.execute(() -> {
                connectPending.set(false);
                connect();
            });
        } catch (RejectedExecutionException e) {
            connectPending.set(false);
            log.debug("Sink '{}' worker rejected connect request: {}", id, e.getMessage());
        }
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) return;

        final ScheduledExecutorService w = Executors.newSingleThreadScheduledExecutor(
                new NamedDaemonThreadFactory("sink-" + id));
        this.worker = w;

        final Duration tick = tickInterval();
        if (tick != null && !tick.isNegative() && !tick.isZero()) {
            final long ms = Math.max(1L, tick.toMillis());
            w.scheduleWithFixedDelay(this::onTick, ms, ms, TimeUnit.MILLISECONDS);
        }

        log.info("Sink '{}' started (capacity={}, overflow={}, retry.max.attempts={})",
                id, backlog.capacity(), backlog.policy(), maxAttempts == 0 ? "unlimited" : maxAttempts);
    }

    @Override
    public void shutdown(Duration timeout) {
        if (!stopping.compareAndSet(false, true)) return;

        final long timeoutNanos = Math.max(0L, Objects.requireNonNull(timeout, "timeout").toNanos());
        final long deadline = now() + timeoutNanos;
        final ScheduledExecutorService w = worker;

        if (w == null) {
            flushAndDisconnect(deadline);
        } else {
            final Future<?> f = w.submit(() -> flushAndDisconnect(deadline));
            try {
                f.get(timeoutNanos, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                f.cancel(true);
                log.warn("Sink '{}' did not finish its final flush within {} ms", id, timeout.toMillis());
            } catch (ExecutionException e) {
                log.warn("Sink '{}' final flush failed", id, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            w.shutdownNow();

            if (state.phase() != SinkState.Phase.DISCONNECTED) {
                // Forced: the worker may still be stuck in backend I/O
                closeConnectionQuietly();
                state = SinkState.disconnected(now());
            }
        }

        log.info("Sink '{}' stopped. sent={} failedSends={} evicted={} expired={} abandoned={}",
                id, sent.sum(), failedSends.sum(), backlog.evictedCount(), expired.sum(), backlog.size());
    }

    @Override
    public int backlogSize() {
        return backlog.size();
    }

    // ---- Internals ----

    /**
     * @return true if the sink is connected afterwards
     */
    private boolean connectLocked() {
        if (state.isConnected()) return true;

        state = SinkState.connecting(consecutiveFailures, now());
        try {
            openConnection();
        } catch (Exception e) {
            connectFailures.increment();
            closeConnectionQuietly();
            state = SinkState.backoff(++consecutiveFailures, now());
            logRateLimited("Sink '" + id + "' connect failed, now " + state, e);
            return false;
        }

        state = SinkState.connected(now());
        log.info("✅ Sink '{}' connected (backlog={})", id, backlog.size());
        return true;
    }

    private void drainLocked(boolean force, boolean bounded, long deadlineNanos) {
        while (state.isConnected() && !backlog.isEmpty()) {
            final long now = now();
            if (bounded && now - deadlineNanos > 0) break;
            if (!force && !readyToFlush(backlog, now)) break;

            final List<BacklogEntry> batch = backlog.peek(Math.max(1, maxBatchSize()));
            final List<LogEvent> events = new ArrayList<>(batch.size());
            for (BacklogEntry e : batch) {
                events.add(e.event());
            }

            try {
                send(events);
            } catch (Exception e) {
                onSendFailure(batch, e);
                return;
            }

            backlog.removeAll(batch);
            sent.add(batch.size());
            consecutiveFailures = 0;
        }
    }

    private void onSendFailure(List<BacklogEntry> batch, Exception e) {
        failedSends.increment();
        final int dropped = backlog.recordFailure(batch, maxAttempts);
        if (dropped > 0) {
            expired.add(dropped);
        }
        closeConnectionQuietly();
        state = SinkState.backoff(++consecutiveFailures, now());
        logRateLimited("Sink '" + id + "' send of " + batch.size() + " events failed, now " + state
                + (dropped > 0 ? " (" + dropped + " events reached the retry limit)" : ""), e);
    }

    private void flushAndDisconnect(long deadlineNanos) {
        synchronized (lock) {
            if (!backlog.isEmpty() && !state.isConnected()) {
                connectLocked();
            }
            drainLocked(true, true, deadlineNanos);
            closeConnectionQuietly();
            state = SinkState.disconnected(now());
        }
    }

    private void onTick() {
        try {
            drain();
        } catch (RuntimeException e) {
            logRateLimited("Sink '" + id + "' tick failed", e);
        }
    }

    private void scheduleDrain() {
        final ScheduledExecutorService w = worker;
        if (w == null || stopping.get()) return;
        if (!drainPending.compareAndSet(false, true)) return;
        try {
            w.execute(() -> {
                drainPending.set(false);
                drain();
            });
        } catch (RejectedExecutionException e) {
            drainPending.set(false);
            log.debug("Sink '{}' worker rejected drain request: {}", id, e.getMessage());
        }
    }

    private void closeConnectionQuietly() {
        try {
            closeConnection();
        } catch (Exception e) {
            log.warn("Sink '{}' error while closing connection: {}", id, e.getMessage());
        }
    }

    private void registerMeters(MeterRegistry registry) {
        FunctionCounter.builder("logshipper_sink_events_accepted_total", accepted, LongAdder::sum)
                .tag("sink", id).register(registry);
        FunctionCounter.builder("logshipper_sink_events_sent_total", sent, LongAdder::sum)
                .tag("sink", id).register(registry);
        FunctionCounter.builder("logshipper_sink_send_failures_total", failedSends, LongAdder::sum)
                .tag("sink", id).register(registry);
        FunctionCounter.builder("logshipper_sink_connect_failures_total", connectFailures, LongAdder::sum)
                .tag("sink", id).register(registry);
        FunctionCounter.builder("logshipper_sink_events_evicted_total", backlog, Backlog::evictedCount)
                .tag("sink", id).register(registry);
        FunctionCounter.builder("logshipper_sink_events_expired_total", expired, LongAdder::sum)
                .tag("sink", id).register(registry);
        Gauge.builder("logshipper_sink_backlog_size", backlog, Backlog::size)
                .tag("sink", id).register(registry);
        Gauge.builder("logshipper_sink_connected", this, s -> s.state().isConnected() ? 1.0 : 0.0)
                .tag("sink", id).register(registry);
    }

    private void logRateLimited(String msg, Exception e) {
        final long nowMs = System.currentTimeMillis();
        final long last = lastErrorLogMs.get();

        if (nowMs - last >= ERROR_LOG_INTERVAL_MS && lastErrorLogMs.compareAndSet(last, nowMs)) {
            final long suppressed = suppressedErrorLogs.sumThenReset();
            if (suppressed > 0) {
                log.warn("{}: {} (suppressed {} similar errors)", msg, e.toString(), suppressed);
            } else {
                log.warn("{}: {}", msg, e.toString());
            }
            log.debug("Sink '{}' failure detail", id, e);
        } else {
            suppressedErrorLogs.increment();
        }
    }

    // ---- Accessors ----

    protected final long now() {
        return nanoClock.getAsLong();
    }

    protected final Backlog backlog() {
        return backlog;
    }

    public long acceptedCount() {
        return accepted.sum();
    }

    public long filteredCount() {
        return filtered.sum();
    }

    public long sentCount() {
        return sent.sum();
    }

    public long failedSendCount() {
        return failedSends.sum();
    }

    public long evictedCount() {
        return backlog.evictedCount();
    }

    public long expiredCount() {
        return expired.sum();
    }

    public long connectFailureCount() {
        return connectFailures.sum();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", state=" + state + ", backlog=" + backlog.size() + '}';
    }
}
