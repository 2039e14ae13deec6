/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.sink;

import com.intuitivedesigns.logshipper.codec.EventCodec;
import com.intuitivedesigns.logshipper.core.LogEvent;
import com.intuitivedesigns.logshipper.metrics.MetricsRuntime;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Debug sink: prints each event in wire format, one per line.
 * The stream is always available, so this sink never backs off.
 */
public final class ConsoleSink extends AbstractBackloggedSink {

    public static final String ID = "console";

    private final PrintStream out;
    private final EventCodec codec;

    public ConsoleSink(PrintStream out,
                       EventCodec codec,
                       Backlog backlog,
                       LongSupplier nanoClock,
                       MetricsRuntime metrics) {
        super(ID, backlog, 0, nanoClock, metrics);
        this.out = Objects.requireNonNull(out, "out");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Connects on the calling thread: there is no backend that could refuse,
     * so the sink is {@code Connected} as soon as it is started.
     */
    @Override
    public void start() {
        super.start();
        connect();
    }

    @Override
    protected void openConnection() {
        // nothing to open
    }

    @Override
    protected void send(List<LogEvent> batch) {
        for (LogEvent event : batch) {
            out.println(codec.encodeToString(event));
        }
        out.flush();
    }

    @Override
    protected void closeConnection() {
        out.flush();
    }
}
