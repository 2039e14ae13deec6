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
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Publishes each event's JSON document to one Kafka topic, keyed by category.
 *
 * <p>A batch is handed to the producer asynchronously and then awaited; the
 * batch only leaves the backlog once every record is acknowledged.</p>
 */
public final class KafkaSink extends AbstractBackloggedSink {

    private static final Logger log = LoggerFactory.getLogger(KafkaSink.class);

    public static final String ID = "kafka";

    private static final String CFG_BOOTSTRAP = "kafka.bootstrap.servers";
    private static final String CFG_TOPIC = "kafka.topic";
    private static final String CFG_SEND_TIMEOUT_MS = "kafka.send.timeout.ms";
    private static final String CFG_BATCH_SIZE = "kafka.batch.size";
    private static final String CFG_RETRY_MAX_ATTEMPTS = "kafka.retry.max.attempts";

    private static final String DEFAULT_TOPIC = "udplog";
    private static final long DEFAULT_SEND_TIMEOUT_MS = 10_000L;
    private static final int DEFAULT_BATCH_SIZE = 500;

    private final Supplier<Producer<String, String>> producerFactory;
    private final String topic;
    private final EventCodec codec;
    private final long sendTimeoutMs;
    private final int batchSize;

    // Micrometer (optional)
    private final Timer sendLatencyTimer;

    private volatile Producer<String, String> producer;

    public KafkaSink(Supplier<Producer<String, String>> producerFactory,
                     String topic,
                     EventCodec codec,
                     Backlog backlog,
                     long sendTimeoutMs,
                     int batchSize,
                     int retryMaxAttempts,
                     MetricsRuntime metrics) {
        super(ID, backlog, retryMaxAttempts, System::nanoTime, metrics);
        this.producerFactory = Objects.requireNonNull(producerFactory, "producerFactory");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sendTimeoutMs = Math.max(1L, sendTimeoutMs);
        this.batchSize = Math.max(1, batchSize);

        final MeterRegistry registry = (metrics != null && metrics.enabled() && metrics.registry() instanceof MeterRegistry mr)
                ? mr
                : null;
        this.sendLatencyTimer = (registry == null)
                ? null
                : registry.timer("logshipper_kafka_send_latency", "topic", topic);
    }

    public static boolean isEnabled(ShipperConfig config) {
        return config.hasPath(CFG_BOOTSTRAP);
    }

    public static KafkaSink fromConfig(ShipperConfig config, EventCodec codec, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        final String topic = config.getString(CFG_TOPIC, DEFAULT_TOPIC);
        final Properties props = buildProducerProps(config);

        log.info("Kafka sink configured: bootstrap={} topic='{}'", props.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG), topic);

        return new KafkaSink(
                () -> new KafkaProducer<>(props),
                topic,
                codec,
                Backlog.fromConfig(config, ID),
                config.getLong(CFG_SEND_TIMEOUT_MS, DEFAULT_SEND_TIMEOUT_MS),
                config.getInt(CFG_BATCH_SIZE, DEFAULT_BATCH_SIZE),
                config.getInt(CFG_RETRY_MAX_ATTEMPTS, 0),
                metrics);
    }

    static Properties buildProducerProps(ShipperConfig config) {
        final Properties props = new Properties();

        // Connectivity
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getString(CFG_BOOTSTRAP, "localhost:9092"));
        props.put(ProducerConfig.CLIENT_ID_CONFIG, config.getString("kafka.client.id", "udplog-" + hostName()));
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());

        // Durability: retries are the sink's job
        props.put(ProducerConfig.ACKS_CONFIG, config.getString("kafka.producer.acks", "1"));
        props.put(ProducerConfig.LINGER_MS_CONFIG, Integer.toString(config.getInt("kafka.producer.linger.ms", 5)));
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG,
                Long.toString(config.getLong(CFG_SEND_TIMEOUT_MS, DEFAULT_SEND_TIMEOUT_MS)));
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG,
                Long.toString(Math.min(config.getLong(CFG_SEND_TIMEOUT_MS, DEFAULT_SEND_TIMEOUT_MS), 30_000L)));
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, config.getString("kafka.producer.compression", "none"));

        // Security passthrough: kafka.ssl.*, kafka.security.*, kafka.sasl.* -> strip "kafka."
        for (String key : config.keys()) {
            if (key.startsWith("kafka.ssl.") || key.startsWith("kafka.security.") || key.startsWith("kafka.sasl.")) {
                final String v = config.getString(key, null);
                if (v != null) props.put(key.substring(6), v);
            }
        }
        return props;
    }

    @Override
    protected void openConnection() throws SinkException {
        if (producer != null) return;
        try {
            producer = producerFactory.get();
        } catch (KafkaException e) {
            throw SinkException.connect("Kafka producer could not be created", e);
        }
    }

    @Override
    protected void send(List<LogEvent> batch) throws SinkException {
        final Producer<String, String> p = producer;
        if (p == null) throw SinkException.send("Kafka producer is not open");

        final long startNs = System.nanoTime();
        final List<Future<RecordMetadata>> acks = new ArrayList<>(batch.size());
        try {
            for (LogEvent event : batch) {
                acks.add(p.send(new ProducerRecord<>(topic, event.category(), codec.writeJson(event.toDocument()))));
            }
            p.flush();

            final long deadline = startNs + TimeUnit.MILLISECONDS.toNanos(sendTimeoutMs);
            for (Future<RecordMetadata> ack : acks) {
                ack.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw SinkException.send("Interrupted while awaiting Kafka acks", e);
        } catch (ExecutionException e) {
            throw SinkException.send("Kafka write failed topic=" + topic, e.getCause());
        } catch (TimeoutException e) {
            throw SinkException.send("Kafka acks not received within " + sendTimeoutMs + " ms", e);
        } catch (KafkaException e) {
            throw SinkException.send("Kafka write failed topic=" + topic, e);
        } finally {
            if (sendLatencyTimer != null) {
                sendLatencyTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
            }
        }
    }

    @Override
    protected void closeConnection() {
        final Producer<String, String> p = producer;
        producer = null;
        if (p == null) return;
        log.info("Closing Kafka producer (topic={})...", topic);
        try {
            p.close(Duration.ofSeconds(5));
        } catch (KafkaException e) {
            log.warn("Kafka producer close failed: {}", e.getMessage());
        }
    }

    @Override
    protected int maxBatchSize() {
        return batchSize;
    }

    public String topic() {
        return topic;
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getCanonicalHostName();
        } catch (UnknownHostException e) {
            log.debug("Local host name unavailable: {}", e.getMessage());
            return "localhost";
        }
    }
}
