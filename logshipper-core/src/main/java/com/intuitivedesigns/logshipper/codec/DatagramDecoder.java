/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.codec;

import com.intuitivedesigns.logshipper.core.LogEvent;

/**
 * Turns one received datagram into one event.
 *
 * <p>Implementations are stateless and safe to call from the listener thread.
 * They must not retain {@code data}: the listener reuses its receive buffer.</p>
 */
@FunctionalInterface
public interface DatagramDecoder {

    LogEvent decode(byte[] data, int offset, int length) throws DecodeException;

    default LogEvent decode(byte[] data) throws DecodeException {
        return decode(data, 0, data.length);
    }
}
