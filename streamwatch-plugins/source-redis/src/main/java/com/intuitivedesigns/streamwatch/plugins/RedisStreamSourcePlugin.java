/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.plugins;

import com.intuitivedesigns.streamwatch.config.SourceSettings;
import com.intuitivedesigns.streamwatch.config.WatchConfig;
import com.intuitivedesigns.streamwatch.core.StreamEvent;
import com.intuitivedesigns.streamwatch.metrics.MetricsRuntime;
import com.intuitivedesigns.streamwatch.source.ResilientSource;
import com.intuitivedesigns.streamwatch.sources.redis.JedisOpener;
import com.intuitivedesigns.streamwatch.sources.redis.RedisFailureClassifier;
import com.intuitivedesigns.streamwatch.sources.redis.RedisStreamDecoder;
import com.intuitivedesigns.streamwatch.sources.redis.RedisStreamFactory;
import com.intuitivedesigns.streamwatch.sources.redis.StreamCursor;
import com.intuitivedesigns.streamwatch.spi.SourcePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.resps.StreamEntry;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Tails one Redis stream with {@code XREAD}.
 *
 * <p>The password comes from {@code <APP_NAME>__REDIS_PASSWORD}. The socket timeout must exceed
 * the {@code BLOCK} time or every idle read surfaces as a connection failure.</p>
 */
public final class RedisStreamSourcePlugin implements SourcePlugin {

    private static final Logger log = LoggerFactory.getLogger(RedisStreamSourcePlugin.class);

    public static final String ID = "REDIS_STREAM";

    // Config Keys
    static final String CFG_HOST = "source.redis.host";
    static final String CFG_PORT = "source.redis.port";
    static final String CFG_TIMEOUT = "source.redis.timeout.ms";
    static final String CFG_POOL_MAX = "source.redis.pool.max";
    static final String CFG_STREAM = "source.redis.stream";
    static final String CFG_INITIAL_ID = "source.redis.initial.id";
    static final String CFG_COUNT = "source.redis.count";
    static final String CFG_BLOCK = "source.redis.block.ms";

    static final String ENV_PASSWORD = "REDIS_PASSWORD";

    // Defaults
    private static final String DEFAULT_INITIAL_ID = "0-0";
    private static final int DEFAULT_COUNT = 1;
    private static final long DEFAULT_BLOCK_MS = 1_000L;
    private static final int DEFAULT_TIMEOUT_MS = 5_000;
    static final Duration DEFAULT_WATCHDOG = Duration.ofSeconds(30);
    static final Duration DEFAULT_IDLE = Duration.ofSeconds(10);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ResilientSource<StreamEntry, StreamEvent<Map<String, String>>> create(WatchConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        String host = config.getString(CFG_HOST, "localhost");
        int port = config.getInt(CFG_PORT, 6379);
        int timeout = config.getInt(CFG_TIMEOUT, DEFAULT_TIMEOUT_MS);
        String password = config.getDomainEnv(ENV_PASSWORD);

        long blockMs = config.getLong(CFG_BLOCK, DEFAULT_BLOCK_MS);
        if (blockMs >= timeout) {
            log.warn("{}={} is not below {}={}; idle reads will time out", CFG_BLOCK, blockMs, CFG_TIMEOUT, timeout);
        }

        // One connection per handle; a spare covers the overlap while a stale one is returned
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(config.getInt(CFG_POOL_MAX, 2));
        poolConfig.setTestOnBorrow(true);

        JedisPool pool = password.isBlank()
                ? new JedisPool(poolConfig, host, port, timeout)
                : new JedisPool(poolConfig, host, port, timeout, password);

        try {
            log.info("Redis stream source: {}:{} stream={}", host, port, config.require(CFG_STREAM));
            return build(config, metrics, pool::getResource, pool);
        } catch (RuntimeException e) {
            pool.close();
            throw e;
        }
    }

    static ResilientSource<StreamEntry, StreamEvent<Map<String, String>>> build(WatchConfig config,
                                                                               MetricsRuntime metrics,
                                                                               JedisOpener opener,
                                                                               AutoCloseable pool) {
        String stream = config.require(CFG_STREAM);
        StreamCursor cursor = StreamCursor.from(config.getString(CFG_INITIAL_ID, DEFAULT_INITIAL_ID));
        RedisStreamFactory factory = new RedisStreamFactory(
                stream,
                opener,
                cursor,
                config.getInt(CFG_COUNT, DEFAULT_COUNT),
                Duration.ofMillis(config.getLong(CFG_BLOCK, DEFAULT_BLOCK_MS)));

        return ResilientSource.<StreamEntry, StreamEvent<Map<String, String>>>builder()
                .name("redis:" + stream)
                .connectionFactory(factory)
                .decoder(new RedisStreamDecoder(stream))
                .classifier(new RedisFailureClassifier())
                .settings(SourceSettings.fromConfig(config, DEFAULT_WATCHDOG, DEFAULT_IDLE))
                .metrics(metrics)
                .closeOnTermination(pool)
                .build();
    }
}
