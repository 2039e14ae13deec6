/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * One structured log record as received from a local application.
 *
 * Design Principles:
 * - Immutability: shared by reference across every sink at once.
 * - Fidelity: the {@code timestamp} field keeps whatever form the sender used
 *   (numeric or string); {@link #timestamp()} only interprets it.
 * - JSON shape: numbers are held the way a JSON parser yields them (the
 *   narrowest of Integer, Long, BigInteger; Double for fractions), nested
 *   maps and collections are copied, so an event equals its own decoded wire form.
 *
 * @param category Event category, restricted to {@code [0-9A-Za-z_]+}.
 * @param fields   JSON-compatible field values (null values allowed).
 */
public record LogEvent(String category, Map<String, Object> fields) {

    public static final String TIMESTAMP_FIELD = "timestamp";
    public static final String CATEGORY_FIELD = "category";

    private static final Pattern CATEGORY = Pattern.compile("[0-9A-Za-z_]+");

    public LogEvent {
        Objects.requireNonNull(category, "LogEvent category cannot be null");
        if (!isValidCategory(category)) {
            throw new IllegalArgumentException("Invalid category: '" + category + "'");
        }
        fields = (fields == null) ? Map.of() : normalizeMap(fields);
    }

    public static LogEvent of(String category, Map<String, Object> fields) {
        return new LogEvent(category, fields);
    }

    public static boolean isValidCategory(String category) {
        return category != null && CATEGORY.matcher(category).matches();
    }

    // LinkedHashMap keeps JSON nulls, which Map.copyOf would reject
    private static Map<String, Object> normalizeMap(Map<?, ?> source) {
        final Map<String, Object> copy = new LinkedHashMap<>(Math.max(4, source.size() * 2));
        for (Map.Entry<?, ?> e : source.entrySet()) {
            copy.put(String.valueOf(e.getKey()), normalize(e.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Double) return value;
        if (value instanceof Byte || value instanceof Short) return ((Number) value).intValue();
        if (value instanceof Long l) return narrow(BigInteger.valueOf(l));
        if (value instanceof BigInteger b) return narrow(b);
        // Float.toString is what the encoder writes, so decode sees the same digits
        if (value instanceof Float f) return Double.parseDouble(Float.toString(f));
        if (value instanceof BigDecimal d) return d.doubleValue();
        if (value instanceof Map<?, ?> m) return normalizeMap(m);
        if (value instanceof Collection<?> c) {
            final List<Object> list = new ArrayList<>(c.size());
            for (Object item : c) {
                list.add(normalize(item));
            }
            return Collections.unmodifiableList(list);
        }
        return value;
    }

    private static Number narrow(BigInteger b) {
        if (b.bitLength() < 32) return b.intValue();
        if (b.bitLength() < 64) return b.longValue();
        return b;
    }

    /**
     * The event time in seconds since the epoch, if the {@code timestamp}
     * field is present and numeric (or a numeric string).
     */
    public OptionalDouble timestamp() {
        final Object raw = fields.get(TIMESTAMP_FIELD);
        if (raw instanceof Number n) {
            return OptionalDouble.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return OptionalDouble.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException ignored) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    public boolean hasTimestampField() {
        return fields.containsKey(TIMESTAMP_FIELD);
    }

    /**
     * Returns a copy carrying the given timestamp (seconds since epoch).
     */
    public LogEvent withTimestamp(double epochSeconds) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(TIMESTAMP_FIELD, epochSeconds);
        return new LogEvent(category, copy);
    }

    /**
     * The fields plus the category, as shipped to JSON document backends.
     */
    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>(fields);
        doc.put(CATEGORY_FIELD, category);
        return doc;
    }

    /**
     * Optional {@code logLevel} field (as sent by the logging shims).
     */
    public String logLevel() {
        final Object level = fields.get("logLevel");
        return (level == null) ? null : String.valueOf(level);
    }
}
