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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.exceptions.JedisException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * LPUSHes JSON documents onto a list key, spreading batches round-robin over
 * several Redis hosts.
 *
 * <p>A host that fails mid-send leaves the live set and the batch moves on to
 * the next host. With no live host left the send fails and the sink backs
 * off; reconnecting reopens every host.</p>
 */
public final class RedisListSink extends AbstractBackloggedSink {

    private static final Logger log = LoggerFactory.getLogger(RedisListSink.class);

    public static final String ID = "redis";

    private static final String CFG_HOSTS = "redis.hosts";
    private static final String CFG_KEY = "redis.key";
    private static final String CFG_TIMEOUT_MS = "redis.timeout.ms";
    private static final String CFG_BATCH_SIZE = "redis.batch.size";
    private static final String CFG_RETRY_MAX_ATTEMPTS = "redis.retry.max.attempts";

    private static final String DEFAULT_KEY = "udplog";
    private static final int DEFAULT_PORT = 6379;
    private static final int DEFAULT_TIMEOUT_MS = 2_000;
    private static final int DEFAULT_BATCH_SIZE = 100;

    private final List<HostAndPort> hosts;
    private final Function<HostAndPort, Jedis> clientFactory;
    private final String key;
    private final EventCodec codec;
    private final int batchSize;

    private final List<Live> live = new ArrayList<>();
    private int next;

    private record Live(HostAndPort host, Jedis client) {
    }

    public RedisListSink(List<HostAndPort> hosts,
                         Function<HostAndPort, Jedis> clientFactory,
                         String key,
                         EventCodec codec,
                         Backlog backlog,
                         int batchSize,
                         int retryMaxAttempts,
                         MetricsRuntime metrics) {
        super(ID, backlog, retryMaxAttempts, System::nanoTime, metrics);
        if (hosts == null || hosts.isEmpty()) throw new IllegalArgumentException("At least one Redis host is required");
        this.hosts = List.copyOf(hosts);
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.key = Objects.requireNonNull(key, "key");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.batchSize = Math.max(1, batchSize);
    }

    public static boolean isEnabled(ShipperConfig config) {
        return config.hasPath(CFG_HOSTS);
    }

    public static RedisListSink fromConfig(ShipperConfig config, EventCodec codec, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        final List<HostAndPort> hosts = parseHosts(config.getString(CFG_HOSTS, ""));
        final String key = config.getString(CFG_KEY, DEFAULT_KEY);
        final JedisClientConfig clientConfig = DefaultJedisClientConfig.builder()
                .timeoutMillis(config.getInt(CFG_TIMEOUT_MS, DEFAULT_TIMEOUT_MS))
                .clientName("logshipper")
                .build();

        log.info("Redis sink configured: hosts={} key='{}'", hosts, key);

        return new RedisListSink(
                hosts,
                hp -> new Jedis(hp, clientConfig),
                key,
                codec,
                Backlog.fromConfig(config, ID),
                config.getInt(CFG_BATCH_SIZE, DEFAULT_BATCH_SIZE),
                config.getInt(CFG_RETRY_MAX_ATTEMPTS, 0),
                metrics);
    }

    /**
     * Comma-separated {@code host[:port]} list; the port defaults to 6379.
     */
    static List<HostAndPort> parseHosts(String raw) {
        final List<HostAndPort> out = new ArrayList<>();
        if (raw == null) return out;
        for (String part : raw.split(",")) {
            final String s = part.trim();
            if (s.isEmpty()) continue;
            final int colon = s.lastIndexOf(':');
            if (colon < 0) {
                out.add(new HostAndPort(s, DEFAULT_PORT));
            } else {
                try {
                    out.add(new HostAndPort(s.substring(0, colon), Integer.parseInt(s.substring(colon + 1))));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Bad Redis host '" + s + "'", e);
                }
            }
        }
        return out;
    }

    @Override
    protected void openConnection() throws SinkException {
        closeConnection();
        JedisException last = null;
        for (HostAndPort hp : hosts) {
            Jedis client = null;
            try {
                client = clientFactory.apply(hp);
                client.ping();
                live.add(new Live(hp, client));
            } catch (JedisException e) {
                last = e;
                if (client != null) closeQuietly(client);
                log.debug("Redis host {} unavailable: {}", hp, e.getMessage());
            }
        }
        if (live.isEmpty()) {
            throw SinkException.connect("No Redis host reachable among " + hosts, last);
        }
        next = 0;
        if (live.size() < hosts.size()) {
            log.warn("Redis sink running on {}/{} hosts", live.size(), hosts.size());
        }
    }

    @Override
    protected void send(List<LogEvent> batch) throws SinkException {
        final String[] values = new String[batch.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = codec.writeJson(batch.get(i).toDocument());
        }

        while (!live.isEmpty()) {
            final int idx = Math.floorMod(next++, live.size());
            final Live target = live.get(idx);
            try {
                target.client().lpush(key, values);
                return;
            } catch (JedisException e) {
                live.remove(idx);
                closeQuietly(target.client());
                log.warn("Redis host {} dropped from rotation: {}", target.host(), e.getMessage());
            }
        }
        throw SinkException.send("No live Redis host for " + values.length + " events");
    }

    @Override
    protected void closeConnection() {
        for (Live l : live) {
            closeQuietly(l.client());
        }
        live.clear();
    }

    @Override
    protected int maxBatchSize() {
        return batchSize;
    }

    List<HostAndPort> liveHosts() {
        final List<HostAndPort> out = new ArrayList<>(live.size());
        for (Live l : live) out.add(l.host());
        return out;
    }

    private static void closeQuietly(Jedis client) {
        try {
            client.close();
        } catch (JedisException e) {
            log.debug("Redis close failed: {}", e.getMessage());
        }
    }
}
