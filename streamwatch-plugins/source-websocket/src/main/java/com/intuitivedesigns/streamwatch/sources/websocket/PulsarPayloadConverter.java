/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.streamwatch.codec.AvroJson;
import com.intuitivedesigns.streamwatch.core.EventDecodeException;
import com.intuitivedesigns.streamwatch.core.StreamEvent;
import org.apache.avro.Schema;

import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Decodes the base64 Avro payload of a {@link PulsarWebSocketMessage} into JSON.
 *
 * <p>Message properties are carried as metadata alongside {@code pulsar.key},
 * {@code pulsar.publish.time} and {@code pulsar.redelivery.count}.</p>
 */
public final class PulsarPayloadConverter
        implements TwoStageDecoder.MessageConverter<PulsarWebSocketMessage, StreamEvent<JsonNode>> {

    public static final String META_KEY = "pulsar.key";
    public static final String META_PUBLISH_TIME = "pulsar.publish.time";
    public static final String META_REDELIVERY_COUNT = "pulsar.redelivery.count";

    private final Schema valueSchema;

    public PulsarPayloadConverter(Schema valueSchema) {
        this.valueSchema = Objects.requireNonNull(valueSchema, "valueSchema");
    }

    @Override
    public StreamEvent<JsonNode> convert(PulsarWebSocketMessage msg) throws EventDecodeException {
        byte[] payload;
        try {
            payload = msg.payload() == null ? new byte[0] : Base64.getDecoder().decode(msg.payload());
        } catch (IllegalArgumentException e) {
            throw new EventDecodeException("Payload of message " + msg.messageId() + " is not base64", e);
        }
        JsonNode data = AvroJson.toTree(payload, valueSchema);

        Map<String, String> md = new HashMap<>(msg.properties());
        if (msg.key() != null) md.put(META_KEY, msg.key());
        if (msg.publishTime() != null) md.put(META_PUBLISH_TIME, msg.publishTime());
        md.put(META_REDELIVERY_COUNT, String.valueOf(msg.redeliveryCount()));

        String id = msg.messageId() != null ? msg.messageId() : UUID.randomUUID().toString();
        return new StreamEvent<>(id, data, md);
    }
}
