/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.core;

import java.util.Objects;

/**
 * Connection state of one sink.
 *
 * <p>{@code BACKOFF} carries the consecutive failure count {@code attempt}
 * (Backoff(n)); every other phase carries 0. {@code sinceNanos} is the
 * {@link System#nanoTime()}-style instant the phase was entered, which the
 * supervisor uses to time the next reconnect.</p>
 *
 * @param phase      current phase
 * @param attempt    backoff level, 0 unless {@code phase == BACKOFF}
 * @param sinceNanos monotonic instant the phase was entered
 */
public record SinkState(Phase phase, int attempt, long sinceNanos) {

    public enum Phase {
        DISCONNECTED,
        CONNECTING,
        CONNECTED,
        BACKOFF
    }

    public SinkState {
        Objects.requireNonNull(phase, "phase");
        if (phase == Phase.BACKOFF && attempt < 1) {
            throw new IllegalArgumentException("Backoff attempt must be >= 1");
        }
        if (phase != Phase.BACKOFF && phase != Phase.CONNECTING) {
            attempt = 0;
        }
    }

    public static SinkState disconnected(long nowNanos) {
        return new SinkState(Phase.DISCONNECTED, 0, nowNanos);
    }

    /**
     * Connecting keeps the attempt it came from so a failure can advance it.
     */
    public static SinkState connecting(int previousAttempt, long nowNanos) {
        return new SinkState(Phase.CONNECTING, Math.max(0, previousAttempt), nowNanos);
    }

    public static SinkState connected(long nowNanos) {
        return new SinkState(Phase.CONNECTED, 0, nowNanos);
    }

    public static SinkState backoff(int attempt, long nowNanos) {
        return new SinkState(Phase.BACKOFF, attempt, nowNanos);
    }

    public boolean isConnected() {
        return phase == Phase.CONNECTED;
    }

    @Override
    public String toString() {
        return switch (phase) {
            case BACKOFF -> "Backoff(" + attempt + ")";
            case CONNECTED -> "Connected";
            case CONNECTING -> "Connecting";
            case DISCONNECTED -> "Disconnected";
        };
    }
}
