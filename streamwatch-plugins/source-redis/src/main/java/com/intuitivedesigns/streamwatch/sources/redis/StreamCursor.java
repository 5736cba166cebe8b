/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.redis;

import redis.clients.jedis.StreamEntryID;

import java.util.Objects;

/**
 * Position of the last entry handed to the source. Outlives individual connections so a
 * reconnect resumes after it instead of replaying from the initial id.
 */
public final class StreamCursor {

    private volatile StreamEntryID position;

    public StreamCursor(StreamEntryID initial) {
        this.position = Objects.requireNonNull(initial, "initial");
    }

    /**
     * Parses an XREAD start id: {@code "$"} for entries added after the first read, otherwise
     * an explicit {@code <ms>-<seq>} id such as {@code "0-0"}.
     */
    public static StreamCursor from(String initialId) {
        Objects.requireNonNull(initialId, "initialId");
        String id = initialId.trim();
        if ("$".equals(id)) {
            return new StreamCursor(StreamEntryID.LAST_ENTRY);
        }
        try {
            return new StreamCursor(new StreamEntryID(id));
        } catch (NumberFormatException | IndexOutOfBoundsException e) {
            throw new IllegalArgumentException("Invalid stream id '" + initialId + "' (expected '$' or <ms>-<seq>)", e);
        }
    }

    public StreamEntryID position() {
        return position;
    }

    void advance(StreamEntryID id) {
        position = id;
    }
}
