/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.pulsar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.intuitivedesigns.streamwatch.codec.AvroJson;
import com.intuitivedesigns.streamwatch.codec.KeyValueSchema;
import com.intuitivedesigns.streamwatch.core.EventDecodeException;
import com.intuitivedesigns.streamwatch.core.EventDecoder;
import com.intuitivedesigns.streamwatch.core.ReceiveResult;
import org.apache.pulsar.client.api.Message;

import java.util.Base64;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Renders the Avro key and payload of a message as JSON.
 *
 * <p>Keys arrive base64-encoded. Producers that set key bytes flag the key as such; a
 * plain-string key is decoded the same way.</p>
 */
public final class PulsarEventDecoder implements EventDecoder<Message<byte[]>, PulsarEvent> {

    private final Supplier<KeyValueSchema> schema;

    public PulsarEventDecoder(Supplier<KeyValueSchema> schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    @Override
    public ReceiveResult<PulsarEvent> decode(Message<byte[]> msg) throws EventDecodeException {
        KeyValueSchema kv = schema.get();
        JsonNode key = msg.hasKey() ? AvroJson.toTree(keyBytes(msg), kv.key()) : NullNode.getInstance();
        JsonNode data = AvroJson.toTree(msg.getData(), kv.value());
        return ReceiveResult.event(new PulsarEvent(msg.getMessageId(), msg.getPublishTime(), key, data));
    }

    private static byte[] keyBytes(Message<byte[]> msg) throws EventDecodeException {
        if (msg.hasBase64EncodedKey()) return msg.getKeyBytes();
        try {
            return Base64.getDecoder().decode(msg.getKey());
        } catch (IllegalArgumentException e) {
            throw new EventDecodeException("Message " + msg.getMessageId() + " has a key that is not base64", e);
        }
    }
}
