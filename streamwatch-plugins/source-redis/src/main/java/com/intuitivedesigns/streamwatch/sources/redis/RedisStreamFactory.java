/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.redis;

import com.intuitivedesigns.streamwatch.core.ConnectionFactory;
import com.intuitivedesigns.streamwatch.core.ConnectionHandle;
import com.intuitivedesigns.streamwatch.core.ConnectionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.params.XReadParams;
import redis.clients.jedis.resps.StreamEntry;

import java.time.Duration;
import java.util.Objects;

/**
 * Borrows one pooled connection per handle and reads the stream with {@code XREAD}.
 */
public final class RedisStreamFactory implements ConnectionFactory<StreamEntry> {

    private static final Logger log = LoggerFactory.getLogger(RedisStreamFactory.class);

    private final String streamKey;
    private final JedisOpener opener;
    private final StreamCursor cursor;
    private final XReadParams params;

    /**
     * @param count entries per read
     * @param block how long one {@code XREAD} waits on the server; zero disables {@code BLOCK}
     */
    public RedisStreamFactory(String streamKey, JedisOpener opener, StreamCursor cursor, int count, Duration block) {
        this.streamKey = Objects.requireNonNull(streamKey, "streamKey");
        this.opener = Objects.requireNonNull(opener, "opener");
        this.cursor = Objects.requireNonNull(cursor, "cursor");
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got " + count);
        }
        XReadParams p = XReadParams.xReadParams().count(count);
        long blockMs = Objects.requireNonNull(block, "block").toMillis();
        this.params = blockMs > 0 ? p.block((int) Math.min(Integer.MAX_VALUE, blockMs)) : p;
    }

    @Override
    public ConnectionHandle<StreamEntry> open(ConnectionListener<StreamEntry> listener) {
        Jedis jedis = opener.open();
        if (jedis == null) {
            throw new IllegalStateException("Jedis opener returned null for stream " + streamKey);
        }
        log.info("🔌 Reading Redis stream {} after {}", streamKey, cursor.position());
        return new StreamReadConnection(streamKey, jedis, cursor, params);
    }

    public StreamCursor cursor() {
        return cursor;
    }
}
