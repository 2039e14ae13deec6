/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.metrics;

/**
 * The vendor-agnostic contract for shipper observability.
 *
 * Design Philosophy:
 * Listener and sinks take this interface so they run unchanged when metrics
 * are disabled (NOOP) or exported (Prometheus). When {@link #enabled()} they
 * read {@link #registry()}, check for a Micrometer {@code MeterRegistry} and
 * register their tagged meters on it.
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Shared no-op runtime for tests and disabled metrics.
     */
    MetricsRuntime NOOP = () -> null;

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for tagged meters.
     * Returns Object so modules without Micrometer meters can still compile against it.
     */
    Object registry();

    /**
     * @return true if metrics are actually being recorded.
     */
    default boolean enabled() { return false; }

    /**
     * @return A string identifier for the implementation (e.g., "MICROMETER", "NOOP").
     */
    default String type() { return "NOOP"; }

    @Override
    default void close() {
        // no-op by default
    }
}
