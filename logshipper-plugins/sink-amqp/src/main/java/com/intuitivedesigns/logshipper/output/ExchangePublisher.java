/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.output;

import com.intuitivedesigns.logshipper.core.SinkException;

/**
 * Client side of one logical broker connection publishing to one exchange.
 * Used from a single thread (the owning sink's worker).
 */
public interface ExchangePublisher extends AutoCloseable {

    /**
     * Connect, open a channel and declare the exchange.
     */
    void open() throws SinkException;

    /**
     * Publish one message. Returns once the broker acknowledged it, or, with
     * confirms disabled, once the client library accepted it.
     */
    void publish(String routingKey, byte[] body) throws SinkException;

    /**
     * Whether a successful {@link #publish} means the broker confirmed the message.
     */
    boolean confirmed();

    /**
     * Release the channel and connection. Safe to call when not open.
     */
    @Override
    void close();
}
