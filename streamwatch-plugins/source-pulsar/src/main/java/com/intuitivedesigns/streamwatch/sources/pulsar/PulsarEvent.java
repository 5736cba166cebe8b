/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.pulsar;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.pulsar.client.api.MessageId;

import java.util.Objects;

/**
 * A decoded Pulsar message.
 *
 * @param messageId Pass to {@link PulsarSource#acknowledge} when auto-ack is off.
 * @param publishTime Broker publish time, epoch millis.
 * @param key The Avro key rendered as JSON ({@code null} node when the message has no key).
 * @param data The Avro payload rendered as JSON ({@code {}} for an empty payload).
 */
public record PulsarEvent(MessageId messageId, long publishTime, JsonNode key, JsonNode data) {

    public PulsarEvent {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(data, "data");
    }
}
