/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.app;

import com.intuitivedesigns.logshipper.core.EventSink;
import com.intuitivedesigns.logshipper.listener.DatagramListener;
import com.intuitivedesigns.logshipper.routing.EventRouter;
import com.intuitivedesigns.logshipper.supervisor.SinkSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The wired daemon: listeners feeding one router, its sinks and their supervisor.
 *
 * <p>Start order is sinks, supervisor, listeners; stop order is the reverse,
 * so no datagram is accepted once the sinks begin their final flush.</p>
 */
public final class Shipper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Shipper.class);

    private final List<DatagramListener> listeners;
    private final EventRouter router;
    private final List<EventSink> sinks;
    private final SinkSupervisor supervisor;
    private final Duration drainTimeout;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    Shipper(List<DatagramListener> listeners,
            EventRouter router,
            SinkSupervisor supervisor,
            Duration drainTimeout) {
        this.listeners = List.copyOf(listeners);
        this.router = Objects.requireNonNull(router, "router");
        this.sinks = router.sinks();
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
    }

    /**
     * @throws IOException if a listener cannot bind; everything started so far is stopped again
     */
    public void start() throws IOException {
        if (!started.compareAndSet(false, true)) return;

        for (EventSink sink : sinks) {
            sink.start();
        }
        supervisor.start();

        try {
            for (DatagramListener listener : listeners) {
                listener.start();
            }
        } catch (IOException e) {
            close();
            throw e;
        }

        log.info("✅ Shipper running: listeners={} sinks={}",
                listeners.stream().map(l -> l.name() + "@" + l.localAddress()).toList(),
                sinks.stream().map(EventSink::id).toList());
    }

    @Override
    public void close() {
        if (!stopped.compareAndSet(false, true)) return;
        log.info("Stopping shipper (drain timeout {} ms)...", drainTimeout.toMillis());

        for (DatagramListener listener : listeners) {
            listener.stop();
        }
        supervisor.stop();
        for (EventSink sink : sinks) {
            try {
                sink.shutdown(drainTimeout);
            } catch (RuntimeException e) {
                log.warn("Sink '{}' shutdown failed", sink.id(), e);
            }
        }
        log.info("Shipper stopped. routed={} sinkErrors={}", router.routedCount(), router.sinkErrorCount());
    }

    public List<DatagramListener> listeners() {
        return listeners;
    }

    public EventRouter router() {
        return router;
    }

    public List<EventSink> sinks() {
        return sinks;
    }
}
