/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.websocket;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.intuitivedesigns.streamwatch.codec.AvroJson;
import com.intuitivedesigns.streamwatch.core.EventDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * A message pushed by the Pulsar WebSocket consumer endpoint.
 *
 * @param messageId Opaque id, echoed back in the ack frame.
 * @param payload Base64-encoded message body.
 * @param properties Application properties.
 * @param publishTime Broker publish time as sent by the server.
 * @param redeliveryCount Times the broker has redelivered this message.
 * @param key Message key, if any.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PulsarWebSocketMessage(
        @JsonProperty("messageId") String messageId,
        @JsonProperty("payload") String payload,
        @JsonProperty("properties") Map<String, String> properties,
        @JsonProperty("publishTime") String publishTime,
        @JsonProperty("redeliveryCount") int redeliveryCount,
        @JsonProperty("key") String key
) {

    private static final Logger log = LoggerFactory.getLogger(PulsarWebSocketMessage.class);

    public PulsarWebSocketMessage {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public static PulsarWebSocketMessage parse(byte[] json) throws EventDecodeException {
        try {
            return AvroJson.mapper().readValue(json, PulsarWebSocketMessage.class);
        } catch (IOException e) {
            throw new EventDecodeException("Not a Pulsar WebSocket message", e);
        }
    }

    /**
     * The consumer-protocol acknowledgement for a raw message. Empty when the message has no id
     * or cannot be parsed; the decoder reports the latter.
     */
    public static Optional<String> ackFrame(byte[] json) {
        try {
            PulsarWebSocketMessage msg = AvroJson.mapper().readValue(json, PulsarWebSocketMessage.class);
            if (msg.messageId() == null) return Optional.empty();
            return Optional.of(AvroJson.mapper().writeValueAsString(Map.of("messageId", msg.messageId())));
        } catch (IOException e) {
            log.debug("Not acknowledging unparseable message: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
