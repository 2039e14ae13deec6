/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.listener;

import com.intuitivedesigns.logshipper.codec.DatagramDecoder;
import com.intuitivedesigns.logshipper.codec.DecodeException;
import com.intuitivedesigns.logshipper.core.LogEvent;
import com.intuitivedesigns.logshipper.metrics.MetricsRuntime;
import com.intuitivedesigns.logshipper.routing.EventRouter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.DatagramChannel;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Receives datagrams on one UDP socket, decodes them and hands every event to the router.
 *
 * <p>The receive loop runs on its own thread and never blocks on anything but
 * the socket: decoding is in-memory and {@link EventRouter#accept(LogEvent)}
 * only enqueues. Undecodable datagrams are counted per reason and dropped.</p>
 *
 * <p>Events without a {@code timestamp} field get one (wall-clock seconds,
 * from the injected {@link Clock}); an existing field is never replaced.</p>
 */
public final class DatagramListener implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DatagramListener.class);

    public static final int MAX_DATAGRAM_BYTES = 65_536;

    private static final long ERROR_LOG_INTERVAL_MS = 5_000L;
    private static final long JOIN_TIMEOUT_MS = 2_000L;

    private final String name;
    private final InetSocketAddress bindAddress;
    private final DatagramDecoder decoder;
    private final EventRouter router;
    private final Clock clock;

    // Runtime state
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile DatagramChannel channel;
    private volatile Thread receiveThread;

    // Fast counters (always on)
    private final LongAdder received = new LongAdder();
    private final LongAdder accepted = new LongAdder();
    private final Map<DecodeException.Kind, LongAdder> dropped = new EnumMap<>(DecodeException.Kind.class);

    // Micrometer (optional)
    private final Map<DecodeException.Kind, Counter> droppedCounters = new EnumMap<>(DecodeException.Kind.class);
    private final Counter receivedCounter;

    // Rate-limited error logging
    private final AtomicLong lastErrorLogMs = new AtomicLong(0);
    private final LongAdder suppressedErrorLogs = new LongAdder();

    public DatagramListener(String name,
                            InetSocketAddress bindAddress,
                            DatagramDecoder decoder,
                            EventRouter router,
                            Clock clock,
                            MetricsRuntime metrics) {
        this.name = Objects.requireNonNull(name, "name");
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.router = Objects.requireNonNull(router, "router");
        this.clock = Objects.requireNonNull(clock, "clock");

        for (DecodeException.Kind kind : DecodeException.Kind.values()) {
            dropped.put(kind, new LongAdder());
        }

        final MeterRegistry registry = (metrics != null && metrics.enabled() && metrics.registry() instanceof MeterRegistry mr)
                ? mr
                : null;

        if (registry != null) {
            this.receivedCounter = registry.counter("logshipper_datagrams_received_total", "listener", name);
            for (DecodeException.Kind kind : DecodeException.Kind.values()) {
                droppedCounters.put(kind, registry.counter(
                        "logshipper_datagrams_dropped_total",
                        "listener", name,
                        "reason", kind.reason()));
            }
        } else {
            this.receivedCounter = null;
        }
    }

    // ---- Lifecycle ----

    /**
     * Bind the socket and start the receive thread.
     *
     * @throws IOException if the address cannot be bound; the daemon cannot run without it
     */
    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) return;

        final DatagramChannel ch = DatagramChannel.open();
        try {
            ch.bind(bindAddress);
        } catch (IOException e) {
            running.set(false);
            ch.close();
            throw new IOException("Cannot bind " + name + " listener to " + bindAddress, e);
        }
        ch.configureBlocking(true);
        this.channel = ch;

        final Thread t = new Thread(this::receiveLoop, "listener-" + name);
        t.setDaemon(true);
        this.receiveThread = t;
        t.start();

        log.info("✅ Listener '{}' receiving on udp://{}", name, localAddress());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) return;

        final DatagramChannel ch = channel;
        if (ch != null) {
            try {
                ch.close();
            } catch (IOException e) {
                log.warn("Error closing listener '{}' socket: {}", name, e.getMessage());
            }
        }

        final Thread t = receiveThread;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        log.info("Listener '{}' stopped. received={} accepted={} dropped={}",
                name, received.sum(), accepted.sum(), dropped);
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * The bound address, useful when configured with port 0.
     */
    public InetSocketAddress localAddress() {
        final DatagramChannel ch = channel;
        if (ch == null) return bindAddress;
        try {
            final SocketAddress local = ch.getLocalAddress();
            return (local instanceof InetSocketAddress isa) ? isa : bindAddress;
        } catch (IOException e) {
            return bindAddress;
        }
    }

    // ---- Receive path ----

    private void receiveLoop() {
        final ByteBuffer buffer = ByteBuffer.allocate(MAX_DATAGRAM_BYTES);
        final DatagramChannel ch = channel;

        while (running.get()) {
            buffer.clear();
            try {
                if (ch.receive(buffer) == null) continue;
            } catch (ClosedChannelException e) {
                break;
            } catch (IOException e) {
                logRateLimited("Receive failed on listener '" + name + "'", e);
                continue;
            }
            buffer.flip();
            handleDatagram(buffer.array(), 0, buffer.limit());
        }
    }

    /**
     * Decode one datagram and route it. Never throws.
     */
    public void handleDatagram(byte[] data, int offset, int length) {
        received.increment();
        if (receivedCounter != null) receivedCounter.increment();

        final LogEvent decoded;
        try {
            decoded = decoder.decode(data, offset, length);
        } catch (DecodeException e) {
            dropped.get(e.kind()).increment();
            final Counter c = droppedCounters.get(e.kind());
            if (c != null) c.increment();
            log.debug("Dropped datagram on '{}' ({}): {}", name, e.kind().reason(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            dropped.get(DecodeException.Kind.INVALID_PAYLOAD).increment();
            logRateLimited("Decoder failed on listener '" + name + "'", e);
            return;
        }

        final LogEvent event = decoded.hasTimestampField()
                ? decoded
                : decoded.withTimestamp(clock.millis() / 1000.0);

        accepted.increment();
        router.accept(event);
    }

    public void handleDatagram(byte[] data) {
        handleDatagram(data, 0, data.length);
    }

    // ---- Stats ----

    public String name() {
        return name;
    }

    public long receivedCount() {
        return received.sum();
    }

    public long acceptedCount() {
        return accepted.sum();
    }

    public long droppedCount(DecodeException.Kind kind) {
        return dropped.get(kind).sum();
    }

    // ---- Helpers ----

    private void logRateLimited(String msg, Exception e) {
        final long now = System.currentTimeMillis();
        final long last = lastErrorLogMs.get();

        if (now - last >= ERROR_LOG_INTERVAL_MS && lastErrorLogMs.compareAndSet(last, now)) {
            final long suppressed = suppressedErrorLogs.sumThenReset();
            if (suppressed > 0) {
                log.error("{} (suppressed {} similar errors)", msg, suppressed, e);
            } else {
                log.error(msg, e);
            }
        } else {
            suppressedErrorLogs.increment();
        }
    }
}
