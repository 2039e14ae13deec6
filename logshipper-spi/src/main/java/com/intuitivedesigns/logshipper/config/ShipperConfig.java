/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Flat key/value configuration.
 * Loads from -Dlogshipper.config.path or ENV 'LOGSHIPPER_CONFIG_PATH'.
 *
 * <p>Instances are owned by the composition root; there is no global copy.</p>
 */
public final class ShipperConfig {

    private static final Logger log = LoggerFactory.getLogger(ShipperConfig.class);

    public static final String PATH_PROPERTY = "logshipper.config.path";
    public static final String PATH_ENV = "LOGSHIPPER_CONFIG_PATH";

    private final Properties props;

    private ShipperConfig(Properties props) {
        this.props = props;
    }

    public static ShipperConfig fromMap(Map<String, String> source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        copy.putAll(source);
        return new ShipperConfig(copy);
    }

    /**
     * Resolve the config file (system property first, then environment) and load it.
     * Running without a file is allowed: every key has a default.
     *
     * @throws UncheckedIOException if a file was named but cannot be read
     */
    public static ShipperConfig load() {
        // 1. Try System Property first (Passed via -Dlogshipper.config.path)
        String path = System.getProperty(PATH_PROPERTY);

        // 2. Fallback to Environment Variable
        if (path == null || path.isBlank()) {
            path = System.getenv(PATH_ENV);
        }

        final Properties props = new Properties();
        if (path != null && !path.isBlank()) {
            log.info("Loading configuration from: {}", path);
            try (InputStream is = new FileInputStream(path)) {
                props.load(is);
                log.info("Loaded {} properties.", props.size());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load config file: " + path, e);
            }
        } else {
            log.warn("No configuration file specified (-D{}=/path/to/logshipper.properties). Using defaults.", PATH_PROPERTY);
        }
        return new ShipperConfig(props);
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-integer value for '{}': '{}'", key, val);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-integer value for '{}': '{}'", key, val);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Double.parseDouble(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value for '{}': '{}'", key, val);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public boolean hasPath(String key) {
        String val = props.getProperty(key);
        return val != null && !val.isBlank();
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }
}
