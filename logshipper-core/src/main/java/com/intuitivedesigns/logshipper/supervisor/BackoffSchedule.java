/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.supervisor;

import java.time.Duration;
import java.util.Objects;

/**
 * Capped exponential reconnect delay.
 *
 * <pre>
 * delay(0) = 0
 * delay(n) = min(max, min * factor^(min(n, cap) - 1))
 * </pre>
 *
 * The schedule is stateless: the attempt number lives in the sink's
 * {@code Backoff(n)} state, and a successful connect resets it to zero.
 */
public final class BackoffSchedule {

    private final long minMillis;
    private final long maxMillis;
    private final double factor;
    private final int cap;

    public BackoffSchedule(Duration min, Duration max, double factor, int cap) {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        if (min.isNegative() || max.isNegative()) throw new IllegalArgumentException("Backoff delays must be >= 0");
        if (max.compareTo(min) < 0) throw new IllegalArgumentException("Backoff max must be >= min");
        if (!(factor >= 1.0)) throw new IllegalArgumentException("Backoff factor must be >= 1.0");
        if (cap < 1) throw new IllegalArgumentException("Backoff cap must be >= 1");

        this.minMillis = min.toMillis();
        this.maxMillis = max.toMillis();
        this.factor = factor;
        this.cap = cap;
    }

    public long delayMillis(int attempt) {
        if (attempt <= 0) return 0L;
        final int exponent = Math.min(attempt, cap) - 1;
        final double raw = minMillis * Math.pow(factor, exponent);
        if (raw >= maxMillis) return maxMillis;
        return (long) raw;
    }

    public long delayNanos(int attempt) {
        return delayMillis(attempt) * 1_000_000L;
    }

    @Override
    public String toString() {
        return "BackoffSchedule{min=" + minMillis + "ms, max=" + maxMillis + "ms, factor=" + factor + ", cap=" + cap + '}';
    }
}
