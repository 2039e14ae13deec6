/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.sink;

import java.util.Locale;

/**
 * What a full backlog does with one more event.
 */
public enum OverflowPolicy {

    /** Evict the oldest queued event and keep the new one. */
    DROP_OLDEST,

    /** Keep the queue as is and discard the new event. */
    DROP_NEWEST;

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static OverflowPolicy parse(String raw, OverflowPolicy fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown backlog overflow policy: '" + raw + "' (expected DROP_OLDEST or DROP_NEWEST)", e);
        }
    }
}
