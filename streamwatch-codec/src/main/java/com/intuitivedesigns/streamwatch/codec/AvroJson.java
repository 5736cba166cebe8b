/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.streamwatch.core.EventDecodeException;
import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.DecoderFactory;
import org.apache.avro.io.EncoderFactory;
import org.apache.avro.io.JsonEncoder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Avro binary to JSON conversion.
 *
 * <p>Output follows Avro's JSON encoding: unions are wrapped in an object keyed by the branch's
 * full type name ({@code {"string": "x"}}).</p>
 */
public final class AvroJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AvroJson() {}

    /**
     * Decodes {@code avroBytes} written with {@code schema} and re-encodes the datum as JSON text.
     */
    public static String toJson(byte[] avroBytes, Schema schema) throws IOException {
        Objects.requireNonNull(avroBytes, "avroBytes");
        Objects.requireNonNull(schema, "schema");

        GenericDatumReader<Object> reader = new GenericDatumReader<>(schema, schema);
        BinaryDecoder decoder = DecoderFactory.get().binaryDecoder(avroBytes, null);
        Object datum = reader.read(null, decoder);
        return datumToJson(datum, schema);
    }

    public static String datumToJson(Object datum, Schema schema) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        GenericDatumWriter<Object> writer = new GenericDatumWriter<>(schema);
        JsonEncoder encoder = EncoderFactory.get().jsonEncoder(schema, out);
        writer.write(datum, encoder);
        encoder.flush();
        return out.toString(StandardCharsets.UTF_8);
    }

    /**
     * Decodes to a Jackson tree. An empty payload decodes to an empty object.
     *
     * @throws EventDecodeException if the bytes do not match the schema
     */
    public static JsonNode toTree(byte[] avroBytes, Schema schema) throws EventDecodeException {
        if (avroBytes == null || avroBytes.length == 0) {
            return MAPPER.createObjectNode();
        }
        try {
            return MAPPER.readTree(toJson(avroBytes, schema));
        } catch (IOException | AvroRuntimeException | IndexOutOfBoundsException e) {
            throw new EventDecodeException("Avro payload does not match schema " + schema.getFullName(), e);
        }
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
