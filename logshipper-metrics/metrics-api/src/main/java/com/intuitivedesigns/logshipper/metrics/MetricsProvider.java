/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.metrics;

/**
 * Service Provider Interface (SPI) for metrics exporters.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and
 * registered in {@code META-INF/services/com.intuitivedesigns.logshipper.metrics.MetricsProvider}.
 * Only the metrics backend is discovered this way; listener, router and sinks
 * are always wired explicitly.</p>
 */
public interface MetricsProvider {

    /**
     * The unique identifier for this provider (e.g., "PROMETHEUS", "NOOP").
     * <p>Matched against the {@code metrics.provider} configuration.
     */
    String id();

    /**
     * Creates a runtime instance for this provider if the settings select it.
     *
     * @param settings The metrics settings.
     * @return A {@link MetricsRuntime}, or {@code null} if this provider was not selected.
     */
    MetricsRuntime create(MetricsSettings settings);

    /**
     * @param configuredId The value from {@code metrics.provider}.
     * @return true if the IDs match (case-insensitive).
     */
    default boolean matches(String configuredId) {
        return configuredId != null && id().equalsIgnoreCase(configuredId.trim());
    }
}
