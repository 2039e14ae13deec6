/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.logshipper.codec.EventCodec;
import com.intuitivedesigns.logshipper.codec.SyslogDecoder;
import com.intuitivedesigns.logshipper.config.ShipperConfig;
import com.intuitivedesigns.logshipper.core.EventSink;
import com.intuitivedesigns.logshipper.listener.DatagramListener;
import com.intuitivedesigns.logshipper.metrics.MetricsRuntime;
import com.intuitivedesigns.logshipper.output.BatchRpcSink;
import com.intuitivedesigns.logshipper.output.ExchangeSink;
import com.intuitivedesigns.logshipper.output.KafkaSink;
import com.intuitivedesigns.logshipper.output.RedisListSink;
import com.intuitivedesigns.logshipper.routing.EventRouter;
import com.intuitivedesigns.logshipper.sink.Backlog;
import com.intuitivedesigns.logshipper.sink.ConsoleSink;
import com.intuitivedesigns.logshipper.supervisor.SinkSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Composition root. Every component is built here from explicit settings;
 * nothing is discovered at runtime apart from the metrics provider.
 */
public final class ShipperFactory {

    private static final Logger log = LoggerFactory.getLogger(ShipperFactory.class);

    static final String UDPLOG_LISTENER = "udplog";
    static final String SYSLOG_LISTENER = "syslog";

    private ShipperFactory() {}

    public static Shipper create(ShipperConfig config, MetricsRuntime metrics) {
        return create(config, ShipperSettings.from(config), metrics, Clock.systemDefaultZone());
    }

    static Shipper create(ShipperConfig config, ShipperSettings settings, MetricsRuntime metrics, Clock clock) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(clock, "clock");

        final ObjectMapper mapper = new ObjectMapper();
        final EventCodec codec = new EventCodec(mapper);

        final List<EventSink> sinks = createSinks(config, settings, codec, mapper, metrics);
        if (sinks.isEmpty()) {
            log.warn("No sink configured: events will be decoded and discarded. Set amqp.host, rpc.url, "
                    + "kafka.bootstrap.servers, redis.hosts or verbose=true.");
        }
        final EventRouter router = new EventRouter(sinks);

        final List<DatagramListener> listeners = new ArrayList<>(2);
        listeners.add(new DatagramListener(UDPLOG_LISTENER, settings.listenAddress, codec, router, clock, metrics));
        settings.syslogAddress().ifPresent(addr -> listeners.add(new DatagramListener(
                SYSLOG_LISTENER,
                addr,
                new SyslogDecoder(clock, clock.getZone(), settings.syslogHostnames),
                router,
                clock,
                metrics)));

        final SinkSupervisor supervisor = new SinkSupervisor(sinks, settings.backoff, settings.supervisorTick, System::nanoTime);

        log.info("Shipper wired: {} | sinks={}", settings, sinks.stream().map(EventSink::id).toList());
        return new Shipper(listeners, router, supervisor, settings.drainTimeout);
    }

    static List<EventSink> createSinks(ShipperConfig config,
                                       ShipperSettings settings,
                                       EventCodec codec,
                                       ObjectMapper mapper,
                                       MetricsRuntime metrics) {
        final List<EventSink> sinks = new ArrayList<>();

        if (ExchangeSink.isEnabled(config)) {
            sinks.add(ExchangeSink.fromConfig(config, codec, metrics));
        }
        if (BatchRpcSink.isEnabled(config)) {
            sinks.add(BatchRpcSink.fromConfig(config, codec, mapper, metrics));
        }
        if (KafkaSink.isEnabled(config)) {
            sinks.add(KafkaSink.fromConfig(config, codec, metrics));
        }
        if (RedisListSink.isEnabled(config)) {
            sinks.add(RedisListSink.fromConfig(config, codec, metrics));
        }
        if (settings.verbose) {
            sinks.add(new ConsoleSink(System.out, codec, Backlog.fromConfig(config, ConsoleSink.ID), System::nanoTime, metrics));
        }
        return sinks;
    }
}
