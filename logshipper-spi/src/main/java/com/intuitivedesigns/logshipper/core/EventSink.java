/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.core;

import java.time.Duration;

/**
 * A downstream destination for log events.
 *
 * Examples:
 * - RabbitMQ exchange
 * - Batched log collector service
 * - Kafka topic
 * - Redis list
 * - Console (debug)
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #offer(LogEvent)} is called from the receive path. It must be O(1),
 * must never block on I/O and must never throw for backend problems.</li>
 * <li>Each sink owns its connection, its backlog and its retry state.
 * Connection and send failures are handled inside the sink and show up only
 * in its {@link #state()} and counters.</li>
 * <li>{@link #connect()} and {@link #disconnect()} run on the sink's own worker.
 * Other threads use {@link #requestConnect()}.</li>
 * </ul>
 */
public interface EventSink extends AutoCloseable {

    /**
     * Identifier used for logging and metrics tagging (e.g., "amqp", "rpc").
     */
    String id();

    /**
     * Enqueue the event for delivery. Never blocks.
     */
    void offer(LogEvent event);

    /**
     * Current connection state. Owned by the sink, safe to read from any thread.
     */
    SinkState state();

    /**
     * Attempt to (re)establish the backend connection.
     *
     * <p><b>Failure Contract:</b> failures are not thrown; they move the sink
     * into {@code Backoff(n)}.</p>
     */
    void connect();

    /**
     * Close the backend connection and move to {@code Disconnected}.
     */
    void disconnect();

    /**
     * Schedule {@link #connect()} on the sink's own worker without waiting.
     */
    void requestConnect();

    /**
     * Start the sink's worker. Called once by the composition root.
     */
    default void start() {
        // no-op by default for sinks without background work
    }

    /**
     * One bounded, best-effort flush of the backlog, then a forced disconnect.
     * Returns within roughly {@code timeout} regardless of backend health.
     */
    void shutdown(Duration timeout);

    /**
     * Events currently buffered and not yet delivered.
     */
    default int backlogSize() {
        return 0;
    }

    @Override
    default void close() {
        shutdown(Duration.ZERO);
    }
}
