/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.metrics;

import com.intuitivedesigns.logshipper.config.ShipperConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration container for the metrics runtime.
 */
public final class MetricsSettings {

    // ---- Config keys ----
    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String KEY_PROM_HOST = "metrics.prometheus.host";
    private static final String KEY_PROM_PORT = "metrics.prometheus.port";
    private static final String KEY_PROM_PATH = "metrics.prometheus.path";

    // ---- Defaults ----
    private static final String DEFAULT_PROVIDER = "NONE";
    private static final String DEFAULT_PROM_HOST = "127.0.0.1";
    private static final int DEFAULT_PROM_PORT = 9090;
    private static final String DEFAULT_PROM_PATH = "/metrics";

    // ---- Public Immutable Fields ----
    public final String providerId;
    public final Map<String, String> commonTags;
    public final String prometheusHost;
    public final int prometheusPort;
    public final String prometheusPath;

    private MetricsSettings(String providerId,
                            Map<String, String> commonTags,
                            String prometheusHost,
                            int prometheusPort,
                            String prometheusPath) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.prometheusHost = prometheusHost;
        this.prometheusPort = prometheusPort;
        this.prometheusPath = prometheusPath;
    }

    public static MetricsSettings from(ShipperConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, DEFAULT_PROVIDER));

        // --- Tag Parsing: metrics.tag.<name>=<value> ---
        final Map<String, String> tags = new LinkedHashMap<>();
        for (String k : config.keys()) {
            if (!k.startsWith(KEY_TAG_PREFIX)) continue;

            final String tagKey = k.substring(KEY_TAG_PREFIX.length()).trim();
            final String value = normalize(config.getString(k, null));
            if (tagKey.isEmpty() || value == null) continue;

            tags.put(tagKey, value);
        }

        final String promHost = firstNonBlank(config.getString(KEY_PROM_HOST, null), DEFAULT_PROM_HOST);
        final int promPort = clampInt(config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT), 0, 65_535);
        String promPath = firstNonBlank(config.getString(KEY_PROM_PATH, null), DEFAULT_PROM_PATH);
        if (!promPath.startsWith("/")) promPath = "/" + promPath;

        return new MetricsSettings(
                provider == null ? DEFAULT_PROVIDER : provider,
                Collections.unmodifiableMap(tags),
                promHost,
                promPort,
                promPath
        );
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", prometheus=" + prometheusHost + ":" + prometheusPort + prometheusPath +
                '}';
    }

    // --- Helpers ---

    private static String firstNonBlank(String a, String b) {
        String s = normalize(a);
        return (s != null) ? s : normalize(b);
    }

    private static String normalize(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalizeUpper(String s) {
        String n = normalize(s);
        return (n != null) ? n.toUpperCase(Locale.ROOT) : null;
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
