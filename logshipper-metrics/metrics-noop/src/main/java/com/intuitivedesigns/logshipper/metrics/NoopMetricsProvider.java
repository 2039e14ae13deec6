/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.metrics;

/**
 * Selected with {@code metrics.provider=NOOP}: nothing is recorded, and the
 * periodic stats line falls back to the sinks' own counters.
 */
public final class NoopMetricsProvider implements MetricsProvider {

    @Override
    public String id() {
        return "NOOP";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        // Do not hijack the factory if another provider (e.g. PROMETHEUS) is requested.
        if (s == null || !matches(s.providerId)) {
            return null;
        }
        return MetricsRuntime.NOOP;
    }
}
