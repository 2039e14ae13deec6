/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.output;

import com.intuitivedesigns.logshipper.codec.EventCodec;
import com.intuitivedesigns.logshipper.config.ShipperConfig;
import com.intuitivedesigns.logshipper.core.LogEvent;
import com.intuitivedesigns.logshipper.core.SinkException;
import com.intuitivedesigns.logshipper.metrics.MetricsRuntime;
import com.intuitivedesigns.logshipper.sink.AbstractBackloggedSink;
import com.intuitivedesigns.logshipper.sink.Backlog;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Publishes each event as one JSON message to a broker exchange, routed by category.
 *
 * <p>Message body: the event's fields plus {@code category}. The
 * {@code timestamp} is sent as a string and {@code isError} is always a
 * boolean, which keeps downstream Logstash mappings stable.</p>
 */
public final class ExchangeSink extends AbstractBackloggedSink {

    private static final Logger log = LoggerFactory.getLogger(ExchangeSink.class);

    public static final String ID = "amqp";

    // ---- Config keys ----
    private static final String CFG_HOST = "amqp.host";
    private static final String CFG_PORT = "amqp.port";
    private static final String CFG_VHOST = "amqp.vhost";
    private static final String CFG_USERNAME = "amqp.username";
    private static final String CFG_PASSWORD = "amqp.password";
    private static final String CFG_EXCHANGE = "amqp.exchange";
    private static final String CFG_EXCHANGE_TYPE = "amqp.exchange.type";
    private static final String CFG_CONFIRMS = "amqp.confirms";
    private static final String CFG_CONFIRM_TIMEOUT_MS = "amqp.confirm.timeout.ms";
    private static final String CFG_CONNECT_TIMEOUT_MS = "amqp.connect.timeout.ms";
    private static final String CFG_RETRY_MAX_ATTEMPTS = "amqp.retry.max.attempts";

    // ---- Defaults ----
    private static final int DEFAULT_PORT = 5672;
    private static final String DEFAULT_VHOST = "/";
    private static final String DEFAULT_USERNAME = "guest";
    private static final String DEFAULT_PASSWORD = "guest";
    private static final String DEFAULT_EXCHANGE = "logs";
    private static final String DEFAULT_EXCHANGE_TYPE = "topic";
    private static final long DEFAULT_CONFIRM_TIMEOUT_MS = 5_000L;
    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 5_000;
    private static final int DEFAULT_RETRY_MAX_ATTEMPTS = 3;

    private final ExchangePublisher publisher;
    private final EventCodec codec;

    public ExchangeSink(ExchangePublisher publisher,
                        EventCodec codec,
                        Backlog backlog,
                        int retryMaxAttempts,
                        LongSupplier nanoClock,
                        MetricsRuntime metrics) {
        super(ID, backlog, retryMaxAttempts, nanoClock, metrics);
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.codec = Objects.requireNonNull(codec, "codec");

        if (!publisher.confirmed()) {
            log.warn("⚠️ AMQP publisher confirms disabled: delivery counts as done once written to the socket.");
        }
    }

    public static boolean isEnabled(ShipperConfig config) {
        return config.hasPath(CFG_HOST);
    }

    public static ExchangeSink fromConfig(ShipperConfig config, EventCodec codec, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");

        final ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(config.getString(CFG_HOST, "localhost").trim());
        factory.setPort(config.getInt(CFG_PORT, DEFAULT_PORT));
        factory.setVirtualHost(config.getString(CFG_VHOST, DEFAULT_VHOST));
        factory.setUsername(config.getString(CFG_USERNAME, DEFAULT_USERNAME));
        factory.setPassword(config.getString(CFG_PASSWORD, DEFAULT_PASSWORD));
        factory.setConnectionTimeout(config.getInt(CFG_CONNECT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS));

        final String exchange = config.getString(CFG_EXCHANGE, DEFAULT_EXCHANGE);
        final String exchangeType = config.getString(CFG_EXCHANGE_TYPE, DEFAULT_EXCHANGE_TYPE);
        final boolean confirms = config.getBoolean(CFG_CONFIRMS, true);
        final long confirmTimeoutMs = config.getLong(CFG_CONFIRM_TIMEOUT_MS, DEFAULT_CONFIRM_TIMEOUT_MS);
        final int retryMax = config.getInt(CFG_RETRY_MAX_ATTEMPTS, DEFAULT_RETRY_MAX_ATTEMPTS);

        log.info("AMQP sink configured: amqp://{}:{}{} exchange='{}' ({})",
                factory.getHost(), factory.getPort(), factory.getVirtualHost(), exchange, exchangeType);

        return new ExchangeSink(
                new RabbitExchangePublisher(factory, exchange, exchangeType, true, confirms, confirmTimeoutMs),
                codec,
                Backlog.fromConfig(config, ID),
                retryMax,
                System::nanoTime,
                metrics);
    }

    @Override
    protected void openConnection() throws SinkException {
        publisher.open();
    }

    @Override
    protected void send(List<LogEvent> batch) throws SinkException {
        for (LogEvent event : batch) {
            publisher.publish(event.category(), codec.writeJsonBytes(toMessage(event)));
        }
    }

    @Override
    protected void closeConnection() {
        publisher.close();
    }

    /**
     * One publish per event keeps retries exact: a failed publish never
     * re-sends events the broker already confirmed.
     */
    @Override
    protected int maxBatchSize() {
        return 1;
    }

    static Map<String, Object> toMessage(LogEvent event) {
        final Map<String, Object> doc = event.toDocument();

        final Object ts = doc.get(LogEvent.TIMESTAMP_FIELD);
        if (ts instanceof Double d) {
            doc.put(LogEvent.TIMESTAMP_FIELD, floatText(d));
        } else if (ts != null) {
            doc.put(LogEvent.TIMESTAMP_FIELD, String.valueOf(ts));
        }

        if (doc.containsKey("isError")) {
            doc.put("isError", truthy(doc.get("isError")));
        }
        return doc;
    }

    // 1379002018.0 -> "1379002018.0", never "1.379002018E9"
    static String floatText(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return String.valueOf(d);
        final String plain = BigDecimal.valueOf(d).toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    private static boolean truthy(Object v) {
        if (v == null) return false;
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.doubleValue() != 0.0;
        if (v instanceof String s) return !s.isEmpty();
        if (v instanceof Collection<?> c) return !c.isEmpty();
        if (v instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }
}
