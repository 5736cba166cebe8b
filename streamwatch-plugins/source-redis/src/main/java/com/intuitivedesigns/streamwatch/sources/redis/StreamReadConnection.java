/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.redis;

import com.intuitivedesigns.streamwatch.core.ConnectionHandle;
import com.intuitivedesigns.streamwatch.core.DeliveryMode;
import com.intuitivedesigns.streamwatch.core.ReceiveResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.params.XReadParams;
import redis.clients.jedis.resps.StreamEntry;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * One borrowed connection. A read returns up to {@code COUNT} entries; they are buffered here
 * and handed out one per pull. Buffered entries the source never pulled are read again by the
 * next connection, since the cursor only moves on hand-out.
 */
final class StreamReadConnection implements ConnectionHandle<StreamEntry> {

    private static final Logger log = LoggerFactory.getLogger(StreamReadConnection.class);

    private final String streamKey;
    private final Jedis jedis;
    private final StreamCursor cursor;
    private final XReadParams params;
    private final Deque<StreamEntry> buffered = new ArrayDeque<>();

    StreamReadConnection(String streamKey, Jedis jedis, StreamCursor cursor, XReadParams params) {
        this.streamKey = streamKey;
        this.jedis = jedis;
        this.cursor = cursor;
        this.params = params;
    }

    @Override
    public DeliveryMode mode() {
        return DeliveryMode.PULL;
    }

    @Override
    public ReceiveResult<StreamEntry> receive() {
        if (buffered.isEmpty()) {
            List<Map.Entry<String, List<StreamEntry>>> reply =
                    jedis.xread(params, Map.of(streamKey, cursor.position()));
            // null when BLOCK expires
            if (reply != null) {
                for (Map.Entry<String, List<StreamEntry>> stream : reply) {
                    if (stream.getValue() != null) buffered.addAll(stream.getValue());
                }
            }
        }

        StreamEntry next = buffered.poll();
        if (next == null) return ReceiveResult.empty();
        cursor.advance(next.getID());
        return ReceiveResult.event(next);
    }

    @Override
    public boolean isActive() {
        return jedis.isConnected() && !jedis.isBroken();
    }

    /**
     * Returns the connection to its pool; a broken one is destroyed by the pool.
     */
    @Override
    public void close() {
        buffered.clear();
        try {
            jedis.close();
        } catch (RuntimeException e) {
            log.warn("Error releasing Redis connection for stream {}", streamKey, e);
        }
    }
}
