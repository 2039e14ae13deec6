/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.app;

import com.intuitivedesigns.logshipper.config.ShipperConfig;
import com.intuitivedesigns.logshipper.supervisor.BackoffSchedule;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable daemon settings resolved from {@link ShipperConfig}.
 * Invalid values fail here, before any socket is opened.
 */
public final class ShipperSettings {

    // ---- Config keys ----
    static final String CFG_LISTEN_HOST = "listen.host";
    static final String CFG_LISTEN_PORT = "listen.port";
    static final String CFG_SYSLOG_HOST = "syslog.host";
    static final String CFG_SYSLOG_PORT = "syslog.port";
    static final String CFG_SYSLOG_HOSTNAME_PREFIX = "syslog.hostname.";
    static final String CFG_BACKOFF_MIN_MS = "backoff.min.ms";
    static final String CFG_BACKOFF_MAX_MS = "backoff.max.ms";
    static final String CFG_BACKOFF_FACTOR = "backoff.factor";
    static final String CFG_BACKOFF_CAP = "backoff.cap";
    static final String CFG_SUPERVISOR_TICK_MS = "supervisor.tick.ms";
    static final String CFG_DRAIN_TIMEOUT_MS = "shutdown.drain.timeout.ms";
    static final String CFG_VERBOSE = "verbose";
    static final String CFG_STATS_INTERVAL_SECONDS = "stats.interval.seconds";

    // ---- Defaults ----
    static final String DEFAULT_HOST = "127.0.0.1";
    static final int DEFAULT_LISTEN_PORT = 55647;
    static final long DEFAULT_BACKOFF_MIN_MS = 1_000L;
    static final long DEFAULT_BACKOFF_MAX_MS = 30_000L;
    static final double DEFAULT_BACKOFF_FACTOR = 2.0;
    static final int DEFAULT_BACKOFF_CAP = 16;
    static final long DEFAULT_SUPERVISOR_TICK_MS = 100L;
    static final long DEFAULT_DRAIN_TIMEOUT_MS = 5_000L;
    static final int DEFAULT_STATS_INTERVAL_SECONDS = 30;

    public final InetSocketAddress listenAddress;
    private final InetSocketAddress syslogAddress;
    public final Map<String, String> syslogHostnames;
    public final BackoffSchedule backoff;
    public final Duration supervisorTick;
    public final Duration drainTimeout;
    public final boolean verbose;
    public final int statsIntervalSeconds;

    private ShipperSettings(InetSocketAddress listenAddress,
                            InetSocketAddress syslogAddress,
                            Map<String, String> syslogHostnames,
                            BackoffSchedule backoff,
                            Duration supervisorTick,
                            Duration drainTimeout,
                            boolean verbose,
                            int statsIntervalSeconds) {
        this.listenAddress = listenAddress;
        this.syslogAddress = syslogAddress;
        this.syslogHostnames = Map.copyOf(syslogHostnames);
        this.backoff = backoff;
        this.supervisorTick = supervisorTick;
        this.drainTimeout = drainTimeout;
        this.verbose = verbose;
        this.statsIntervalSeconds = statsIntervalSeconds;
    }

    /**
     * @throws IllegalArgumentException on out-of-range values
     */
    public static ShipperSettings from(ShipperConfig config) {
        Objects.requireNonNull(config, "config");

        final InetSocketAddress listen = address(
                config.getString(CFG_LISTEN_HOST, DEFAULT_HOST),
                config.getInt(CFG_LISTEN_PORT, DEFAULT_LISTEN_PORT),
                CFG_LISTEN_PORT);

        final InetSocketAddress syslog = config.hasPath(CFG_SYSLOG_PORT)
                ? address(config.getString(CFG_SYSLOG_HOST, DEFAULT_HOST), config.getInt(CFG_SYSLOG_PORT, 0), CFG_SYSLOG_PORT)
                : null;

        final Map<String, String> hostnames = new LinkedHashMap<>();
        for (String key : config.keys()) {
            if (key.startsWith(CFG_SYSLOG_HOSTNAME_PREFIX) && key.length() > CFG_SYSLOG_HOSTNAME_PREFIX.length()) {
                hostnames.put(key.substring(CFG_SYSLOG_HOSTNAME_PREFIX.length()), config.getString(key, "").trim());
            }
        }

        final BackoffSchedule backoff = new BackoffSchedule(
                Duration.ofMillis(config.getLong(CFG_BACKOFF_MIN_MS, DEFAULT_BACKOFF_MIN_MS)),
                Duration.ofMillis(config.getLong(CFG_BACKOFF_MAX_MS, DEFAULT_BACKOFF_MAX_MS)),
                config.getDouble(CFG_BACKOFF_FACTOR, DEFAULT_BACKOFF_FACTOR),
                config.getInt(CFG_BACKOFF_CAP, DEFAULT_BACKOFF_CAP));

        final long tickMs = config.getLong(CFG_SUPERVISOR_TICK_MS, DEFAULT_SUPERVISOR_TICK_MS);
        if (tickMs <= 0) throw new IllegalArgumentException(CFG_SUPERVISOR_TICK_MS + " must be > 0, got " + tickMs);

        final long drainMs = config.getLong(CFG_DRAIN_TIMEOUT_MS, DEFAULT_DRAIN_TIMEOUT_MS);
        if (drainMs < 0) throw new IllegalArgumentException(CFG_DRAIN_TIMEOUT_MS + " must be >= 0, got " + drainMs);

        final int statsSeconds = config.getInt(CFG_STATS_INTERVAL_SECONDS, DEFAULT_STATS_INTERVAL_SECONDS);
        if (statsSeconds < 0) {
            throw new IllegalArgumentException(CFG_STATS_INTERVAL_SECONDS + " must be >= 0, got " + statsSeconds);
        }

        return new ShipperSettings(
                listen,
                syslog,
                hostnames,
                backoff,
                Duration.ofMillis(tickMs),
                Duration.ofMillis(drainMs),
                config.getBoolean(CFG_VERBOSE, false),
                statsSeconds);
    }

    public Optional<InetSocketAddress> syslogAddress() {
        return Optional.ofNullable(syslogAddress);
    }

    private static InetSocketAddress address(String host, int port, String key) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(key + " must be within 0..65535, got " + port);
        }
        final String h = (host == null || host.isBlank()) ? DEFAULT_HOST : host.trim();
        return new InetSocketAddress(h, port);
    }

    @Override
    public String toString() {
        return "ShipperSettings{" +
                "listen=" + listenAddress +
                ", syslog=" + (syslogAddress == null ? "off" : syslogAddress) +
                ", backoff=" + backoff +
                ", supervisorTick=" + supervisorTick.toMillis() + "ms" +
                ", drainTimeout=" + drainTimeout.toMillis() + "ms" +
                ", verbose=" + verbose +
                ", statsInterval=" + statsIntervalSeconds + "s" +
                '}';
    }
}
