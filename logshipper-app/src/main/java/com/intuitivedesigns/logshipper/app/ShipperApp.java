/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.app;

import com.intuitivedesigns.logshipper.concurrent.NamedDaemonThreadFactory;
import com.intuitivedesigns.logshipper.config.ShipperConfig;
import com.intuitivedesigns.logshipper.metrics.MetricsFactory;
import com.intuitivedesigns.logshipper.metrics.MetricsRuntime;
import com.intuitivedesigns.logshipper.metrics.MetricsSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public final class ShipperApp {

    private static final Logger log = LoggerFactory.getLogger(ShipperApp.class);

    private ShipperApp() {}

    public static void main(String[] args) {
        log.info("=== Booting LogShipper ===");

        MetricsRuntime metrics = null;
        Shipper shipper = null;
        ScheduledExecutorService statsScheduler = null;

        final CountDownLatch shutdownLatch = new CountDownLatch(1);
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        try {
            // 1. Configuration
            final ShipperConfig config = ShipperConfig.load();
            final ShipperSettings settings = ShipperSettings.from(config);

            // 2. Metrics
            metrics = MetricsFactory.init(MetricsSettings.from(config));

            // 3. Components
            shipper = ShipperFactory.create(config, metrics);

            // 4. Stats
            if (settings.statsIntervalSeconds > 0) {
                statsScheduler = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("stats-reporter"));
                statsScheduler.scheduleAtFixedRate(new StatsReporter(shipper, System::nanoTime),
                        settings.statsIntervalSeconds, settings.statsIntervalSeconds, TimeUnit.SECONDS);
                log.info("Stats reporter active ({}s interval)", settings.statsIntervalSeconds);
            }

            // 5. Shutdown hook
            final MetricsRuntime finalMetrics = metrics;
            final Shipper finalShipper = shipper;
            final ScheduledExecutorService finalStatsScheduler = statsScheduler;

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (!shutdownStarted.compareAndSet(false, true)) {
                    return;
                }

                log.info("Shutdown signal received.");
                try {
                    if (finalStatsScheduler != null) {
                        finalStatsScheduler.shutdownNow();
                    }
                    finalShipper.close();
                } finally {
                    closeQuietly(finalMetrics);
                    shutdownLatch.countDown();
                }
            }, "shipper-shutdown"));

            // 6. Launch
            shipper.start();

            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted, exiting.");
        } catch (Throwable t) {
            log.error("Fatal application error", t);

            if (shutdownStarted.compareAndSet(false, true)) {
                if (statsScheduler != null) {
                    statsScheduler.shutdownNow();
                }
                if (shipper != null) {
                    shipper.close();
                }
                closeQuietly(metrics);
                shutdownLatch.countDown();
            }

            System.exit(1);
        }
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Close failed for {}: {}", resource.getClass().getSimpleName(), e.getMessage());
        }
    }
}
