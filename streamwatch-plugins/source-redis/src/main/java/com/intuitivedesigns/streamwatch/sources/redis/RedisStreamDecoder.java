/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.redis;

import com.intuitivedesigns.streamwatch.core.EventDecodeException;
import com.intuitivedesigns.streamwatch.core.EventDecoder;
import com.intuitivedesigns.streamwatch.core.ReceiveResult;
import com.intuitivedesigns.streamwatch.core.StreamEvent;
import redis.clients.jedis.resps.StreamEntry;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Emits the entry's field map under the entry id.
 */
public final class RedisStreamDecoder implements EventDecoder<StreamEntry, StreamEvent<Map<String, String>>> {

    public static final String META_STREAM = "redis.stream";
    public static final String META_ENTRY_TIME = "redis.entry.time";

    private final String streamKey;

    public RedisStreamDecoder(String streamKey) {
        this.streamKey = Objects.requireNonNull(streamKey, "streamKey");
    }

    @Override
    public ReceiveResult<StreamEvent<Map<String, String>>> decode(StreamEntry raw) throws EventDecodeException {
        if (raw.getID() == null) {
            throw new EventDecodeException("Entry on stream " + streamKey + " has no id");
        }
        Map<String, String> fields = raw.getFields() == null ? Map.of() : Map.copyOf(raw.getFields());
        Map<String, String> md = Map.of(
                META_STREAM, streamKey,
                // ms part of the id is the server time the entry was added
                META_ENTRY_TIME, Instant.ofEpochMilli(raw.getID().getTime()).toString());
        return ReceiveResult.event(new StreamEvent<>(raw.getID().toString(), fields, md));
    }
}
