/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private MetricsFactory() {}

    /**
     * Pick the provider named by {@code metrics.provider}.
     *
     * <p>Without a match the shipper still needs readable counters for its
     * periodic stats line, so the fallback is an in-memory Micrometer runtime
     * rather than a pure no-op.</p>
     */
    public static MetricsRuntime init(MetricsSettings settings) {
        Objects.requireNonNull(settings, "settings");

        final ServiceLoader<MetricsProvider> loader = ServiceLoader.load(MetricsProvider.class, resolveClassLoader());

        for (MetricsProvider p : loader) {
            try {
                final MetricsRuntime rt = p.create(settings);
                if (rt != null) {
                    log.info("✅ Metrics Runtime initialized: {} ({})", p.id(), rt.type());
                    return rt;
                }
            } catch (Throwable t) {
                // Throwable: a provider missing its exporter jar fails with NoClassDefFoundError
                log.warn("Failed to initialize metrics provider [{}]: {}", p.getClass().getName(), t.getMessage());
                log.debug("Provider init stack trace:", t);
            }
        }

        log.info("No metrics exporter selected (metrics.provider={}). In-memory counters only.", settings.providerId);
        final MicrometerMetricsRuntime fallback = new MicrometerMetricsRuntime("IN_MEMORY");
        MetricsUtil.applyCommonTags(fallback.registry(), settings);
        return fallback;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }
}
