/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.codec;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.avro.Schema;
import org.apache.avro.SchemaParseException;

import java.io.IOException;
import java.util.Objects;

/**
 * Avro schemas for the key and the value of a key/value topic.
 *
 * @param key Schema of the message key.
 * @param value Schema of the message payload.
 */
public record KeyValueSchema(Schema key, Schema value) {

    public KeyValueSchema {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    /**
     * Parses a Pulsar admin schema response: {@code {"data": "{\"key\": {...}, \"value\": {...}}"}}.
     * The {@code data} property is itself JSON text.
     *
     * @throws IOException if the document or either schema is malformed
     */
    public static KeyValueSchema parse(String schemaResponse) throws IOException {
        JsonNode root = AvroJson.mapper().readTree(schemaResponse);
        JsonNode data = root == null ? null : root.get("data");
        if (data == null || !data.isTextual()) {
            throw new IOException("Could not find a data property in schema response");
        }

        JsonNode kv = AvroJson.mapper().readTree(data.asText());
        JsonNode key = kv.get("key");
        JsonNode value = kv.get("value");
        if (key == null || value == null) {
            throw new IOException("Schema data must contain both 'key' and 'value'");
        }

        try {
            // Separate parsers: key and value may define the same record name
            return new KeyValueSchema(
                    new Schema.Parser().parse(key.toString()),
                    new Schema.Parser().parse(value.toString()));
        } catch (SchemaParseException e) {
            throw new IOException("Invalid Avro schema in response: " + e.getMessage(), e);
        }
    }
}
