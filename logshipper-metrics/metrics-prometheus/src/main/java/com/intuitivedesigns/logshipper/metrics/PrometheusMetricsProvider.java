/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.metrics;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Exposes the shipper's counters on a scrape endpoint
 * ({@code metrics.prometheus.host:port/path}).
 */
public final class PrometheusMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsProvider.class);

    private static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    @Override
    public String id() {
        return "PROMETHEUS";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        if (s == null || !matches(s.providerId)) {
            return null;
        }

        final PrometheusMeterRegistry reg = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        final MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime("PROMETHEUS").addRegistry(reg);
        MetricsUtil.applyCommonTags(runtime.registry(), s);

        final ScrapeServer server = ScrapeServer.start(reg, s.prometheusHost, s.prometheusPort, s.prometheusPath);
        log.info("✅ Prometheus scrape endpoint active: http://{}:{}{}", s.prometheusHost, server.port(), s.prometheusPath);

        return new PrometheusRuntime(runtime, server);
    }

    /**
     * The Micrometer runtime plus the scrape server it owns.
     */
    static final class PrometheusRuntime implements MetricsRuntime {
        private final MicrometerMetricsRuntime delegate;
        private final ScrapeServer server;

        private PrometheusRuntime(MicrometerMetricsRuntime delegate, ScrapeServer server) {
            this.delegate = delegate;
            this.server = server;
        }

        int port() {
            return server.port();
        }

        @Override public MeterRegistry registry() { return delegate.registry(); }
        @Override public boolean enabled() { return true; }
        @Override public String type() { return delegate.type(); }

        @Override
        public void close() {
            server.close();
            delegate.close();
        }
    }

    // ---- Scrape endpoint ----

    static final class ScrapeServer implements AutoCloseable {
        private final HttpServer server;
        private final ExecutorService executor;

        private ScrapeServer(HttpServer server, ExecutorService executor) {
            this.server = server;
            this.executor = executor;
        }

        static ScrapeServer start(PrometheusMeterRegistry registry, String host, int port, String path) {
            Objects.requireNonNull(registry, "registry");

            final HttpServer server;
            try {
                server = HttpServer.create(new InetSocketAddress(host, port), 0);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to start Prometheus metrics server on " + host + ":" + port, e);
            }

            final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "metrics-http-server");
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.createContext(path, exchange -> {
                try {
                    final byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
                    exchange.getResponseHeaders().set("Content-Type", CONTENT_TYPE);
                    exchange.sendResponseHeaders(200, bytes.length);
                    try (OutputStream os = exchange.getResponseBody()) {
                        os.write(bytes);
                    }
                } catch (IOException e) {
                    log.debug("Scrape response failed: {}", e.getMessage());
                } finally {
                    exchange.close();
                }
            });

            server.start();
            return new ScrapeServer(server, executor);
        }

        int port() {
            return server.getAddress().getPort();
        }

        @Override
        public void close() {
            server.stop(0);
            executor.shutdownNow();
        }
    }
}
