/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.output;

import com.intuitivedesigns.logshipper.core.SinkException;

import java.util.List;

/**
 * Batch log collector endpoint. One {@link #log} call per batch.
 */
public interface LogCollectorClient extends AutoCloseable {

    enum Result {
        OK,
        TRY_LATER
    }

    /**
     * Prepare the transport. Stateless transports may leave this empty.
     */
    default void open() throws SinkException {
    }

    /**
     * @return {@link Result#TRY_LATER} when the collector is up but refused the batch
     * @throws SinkException on transport failure or an unexpected reply
     */
    Result log(List<LogEntry> entries) throws SinkException;

    @Override
    default void close() {
    }
}
