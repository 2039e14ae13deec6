/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.output;

import java.util.Objects;

/**
 * One collector entry: the category and the event's fields as a JSON string.
 */
public record LogEntry(String category, String message) {

    public LogEntry {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(message, "message");
    }
}
