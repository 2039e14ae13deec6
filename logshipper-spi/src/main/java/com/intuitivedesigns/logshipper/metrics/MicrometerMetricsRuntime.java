/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Metrics bridge for Micrometer.
 *
 * Features:
 * - Composite Registry (in-memory by default, exporters such as Prometheus added on top)
 * - Counters stay readable in-process for the stats line and tests
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry;
    private final String type;

    public MicrometerMetricsRuntime() {
        this("MICROMETER");
    }

    public MicrometerMetricsRuntime(String type) {
        this.type = Objects.requireNonNull(type, "type");
        this.registry = new CompositeMeterRegistry();
        // Always keep an in-memory registry so counters can be read back (stats log, tests)
        this.registry.add(new SimpleMeterRegistry());
    }

    /**
     * Adds a specific registry (e.g., Prometheus) to the composite.
     */
    public MicrometerMetricsRuntime addRegistry(MeterRegistry specificRegistry) {
        this.registry.add(Objects.requireNonNull(specificRegistry, "specificRegistry"));
        return this;
    }

    // --- Interface Implementation ---

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics Runtime Closed ({}).", type);
    }
}
