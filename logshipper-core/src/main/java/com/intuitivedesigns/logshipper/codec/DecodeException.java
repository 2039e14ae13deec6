/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.codec;

import java.util.Locale;

/**
 * A datagram that could not be turned into a {@code LogEvent}.
 * Always recovered by the listener: the datagram is counted and dropped.
 */
public final class DecodeException extends Exception {

    public enum Kind {
        INVALID_CATEGORY,
        INVALID_PAYLOAD;

        /**
         * Metric tag value, e.g. {@code invalid_category}.
         */
        public String reason() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Kind kind;

    public DecodeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DecodeException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static DecodeException invalidCategory(String message) {
        return new DecodeException(Kind.INVALID_CATEGORY, message);
    }

    public static DecodeException invalidPayload(String message, Throwable cause) {
        return new DecodeException(Kind.INVALID_PAYLOAD, message, cause);
    }

    public Kind kind() {
        return kind;
    }
}
