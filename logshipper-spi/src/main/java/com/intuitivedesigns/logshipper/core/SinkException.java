/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.core;

/**
 * Raised by backend clients when a connection cannot be made or a delivery
 * is not acknowledged. Always recovered by the owning sink.
 */
public class SinkException extends Exception {

    public enum Kind {
        CONNECT,
        SEND
    }

    private final Kind kind;

    public SinkException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SinkException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static SinkException connect(String message, Throwable cause) {
        return new SinkException(Kind.CONNECT, message, cause);
    }

    public static SinkException send(String message) {
        return new SinkException(Kind.SEND, message);
    }

    public static SinkException send(String message, Throwable cause) {
        return new SinkException(Kind.SEND, message, cause);
    }

    public Kind kind() {
        return kind;
    }
}
