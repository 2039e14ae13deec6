/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.logshipper.codec.EventCodec;
import com.intuitivedesigns.logshipper.config.ShipperConfig;
import com.intuitivedesigns.logshipper.core.LogEvent;
import com.intuitivedesigns.logshipper.core.SinkException;
import com.intuitivedesigns.logshipper.metrics.MetricsRuntime;
import com.intuitivedesigns.logshipper.sink.AbstractBackloggedSink;
import com.intuitivedesigns.logshipper.sink.Backlog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.LongSupplier;

/**
 * Ships events to a batch log collector, one call per batch.
 *
 * <p>A batch goes out once {@code rpc.batch.size} events are pending or the
 * oldest pending event has waited {@code rpc.flush.interval.ms}, whichever
 * comes first. A {@code TRY_LATER} reply counts as a failed send: the batch
 * stays queued and the sink backs off.</p>
 */
public final class BatchRpcSink extends AbstractBackloggedSink {

    private static final Logger log = LoggerFactory.getLogger(BatchRpcSink.class);

    public static final String ID = "rpc";

    private static final String CFG_URL = "rpc.url";
    private static final String CFG_BATCH_SIZE = "rpc.batch.size";
    private static final String CFG_FLUSH_INTERVAL_MS = "rpc.flush.interval.ms";
    private static final String CFG_TIMEOUT_MS = "rpc.timeout.ms";
    private static final String CFG_MIN_LOG_LEVEL = "rpc.min.log.level";
    private static final String CFG_RETRY_MAX_ATTEMPTS = "rpc.retry.max.attempts";

    private static final int DEFAULT_BATCH_SIZE = 100;
    private static final long DEFAULT_FLUSH_INTERVAL_MS = 2_000L;
    private static final long DEFAULT_TIMEOUT_MS = 5_000L;
    private static final String DEFAULT_MIN_LOG_LEVEL = "INFO";

    // Python logging numbering; syslog names slotted in around it
    private static final Map<String, Integer> LEVELS = Map.ofEntries(
            Map.entry("NOTSET", 0),
            Map.entry("DEBUG", 10),
            Map.entry("INFO", 20),
            Map.entry("NOTICE", 25),
            Map.entry("WARN", 30),
            Map.entry("WARNING", 30),
            Map.entry("ERROR", 40),
            Map.entry("CRITICAL", 50),
            Map.entry("FATAL", 50),
            Map.entry("ALERT", 50),
            Map.entry("EMERGENCY", 50));

    private final LogCollectorClient client;
    private final EventCodec codec;
    private final int batchSize;
    private final Duration flushInterval;
    private final long flushIntervalNanos;
    private final int minLevel;

    public BatchRpcSink(LogCollectorClient client,
                        EventCodec codec,
                        Backlog backlog,
                        int batchSize,
                        Duration flushInterval,
                        String minLogLevel,
                        int retryMaxAttempts,
                        LongSupplier nanoClock,
                        MetricsRuntime metrics) {
        super(ID, backlog, retryMaxAttempts, nanoClock, metrics);
        if (batchSize <= 0) throw new IllegalArgumentException("rpc batch size must be > 0");
        if (flushInterval == null || flushInterval.isNegative() || flushInterval.isZero()) {
            throw new IllegalArgumentException("rpc flush interval must be > 0");
        }
        this.client = Objects.requireNonNull(client, "client");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.batchSize = batchSize;
        this.flushInterval = flushInterval;
        this.flushIntervalNanos = flushInterval.toNanos();

        final Integer min = level(minLogLevel);
        if (min == null) throw new IllegalArgumentException("Unknown log level: " + minLogLevel);
        this.minLevel = min;
    }

    public static boolean isEnabled(ShipperConfig config) {
        return config.hasPath(CFG_URL);
    }

    public static BatchRpcSink fromConfig(ShipperConfig config, EventCodec codec, ObjectMapper mapper, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");

        final URI url = URI.create(config.getString(CFG_URL, "").trim());
        final Duration timeout = Duration.ofMillis(Math.max(1L, config.getLong(CFG_TIMEOUT_MS, DEFAULT_TIMEOUT_MS)));
        final int batchSize = config.getInt(CFG_BATCH_SIZE, DEFAULT_BATCH_SIZE);
        final Duration interval = Duration.ofMillis(config.getLong(CFG_FLUSH_INTERVAL_MS, DEFAULT_FLUSH_INTERVAL_MS));
        final String minLevel = config.getString(CFG_MIN_LOG_LEVEL, DEFAULT_MIN_LOG_LEVEL);

        log.info("RPC sink configured: url={} batch.size={} flush.interval={}ms min.log.level={}",
                url, batchSize, interval.toMillis(), minLevel);

        return new BatchRpcSink(
                new HttpLogCollectorClient(url, timeout, mapper),
                codec,
                Backlog.fromConfig(config, ID),
                batchSize,
                interval,
                minLevel,
                config.getInt(CFG_RETRY_MAX_ATTEMPTS, 0),
                System::nanoTime,
                metrics);
    }

    @Override
    protected void openConnection() throws SinkException {
        client.open();
    }

    @Override
    protected void send(List<LogEvent> batch) throws SinkException {
        final List<LogEntry> entries = new ArrayList<>(batch.size());
        for (LogEvent e : batch) {
            entries.add(new LogEntry(e.category(), codec.writeJson(e.fields())));
        }
        if (client.log(entries) == LogCollectorClient.Result.TRY_LATER) {
            throw SinkException.send("Collector asked to try later (" + entries.size() + " entries)");
        }
    }

    @Override
    protected void closeConnection() {
        client.close();
    }

    @Override
    protected int maxBatchSize() {
        return batchSize;
    }

    @Override
    protected boolean readyToFlush(Backlog backlog, long nowNanos) {
        if (backlog.size() >= batchSize) return true;
        final OptionalLong oldest = backlog.oldestEnqueuedNanos();
        return oldest.isPresent() && nowNanos - oldest.getAsLong() >= flushIntervalNanos;
    }

    /**
     * Ticks at a fraction of the flush interval so an aged batch is not held
     * much past its deadline.
     */
    @Override
    protected Duration tickInterval() {
        return Duration.ofMillis(Math.max(10L, flushInterval.toMillis() / 4));
    }

    @Override
    protected boolean accepts(LogEvent event) {
        final String raw = event.logLevel();
        final Integer level = level(raw == null ? DEFAULT_MIN_LOG_LEVEL : raw);
        // Unknown level names are never filtered
        return level == null || level >= minLevel;
    }

    private static Integer level(String name) {
        if (name == null) return null;
        return LEVELS.get(name.trim().toUpperCase(Locale.ROOT));
    }
}
