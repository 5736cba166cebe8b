/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.core;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The envelope for every decoded event leaving a source.
 *
 * Design Principles:
 * - Immutability: ownership moves to the emitter on emit, nothing mutates it afterwards.
 * - Provenance: transport coordinates (topic, offset, resource name) travel in metadata.
 *
 * @param id Transport-derived identifier (message id, uid:resourceVersion, stream entry id).
 * @param data The decoded payload.
 * @param receivedAt When the source received the raw message.
 * @param metadata Transport context.
 */
public record StreamEvent<T>(
        String id,
        T data,
        Instant receivedAt,
        Map<String, String> metadata
) {

    public StreamEvent {
        Objects.requireNonNull(id, "StreamEvent id cannot be null");
        if (receivedAt == null) receivedAt = Instant.now();

        // Immutable and never null
        metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
    }

    public StreamEvent(String id, T data, Map<String, String> metadata) {
        this(id, data, Instant.now(), metadata);
    }

    public StreamEvent(String id, T data) {
        this(id, data, Instant.now(), Map.of());
    }

    public static <T> StreamEvent<T> of(T data) {
        return new StreamEvent<>(UUID.randomUUID().toString(), data, Instant.now(), Map.of());
    }

    // --- Withers ---

    public <R> StreamEvent<R> withData(R newData) {
        return new StreamEvent<>(id, newData, receivedAt, metadata);
    }

    public StreamEvent<T> withMetadata(String key, String value) {
        Map<String, String> newMeta = new HashMap<>(this.metadata);
        newMeta.put(key, value);
        return new StreamEvent<>(id, data, receivedAt, newMeta);
    }
}
