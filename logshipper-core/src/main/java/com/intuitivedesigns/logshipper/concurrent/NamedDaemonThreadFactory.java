/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.concurrent;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * Daemon threads with a fixed, readable name. Every executor in the shipper
 * owns exactly one thread, so the name is not numbered.
 */
public final class NamedDaemonThreadFactory implements ThreadFactory {

    private final String name;

    public NamedDaemonThreadFactory(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }
}
