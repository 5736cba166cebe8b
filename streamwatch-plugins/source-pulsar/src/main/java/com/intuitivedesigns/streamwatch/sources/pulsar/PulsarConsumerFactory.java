/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.pulsar;

import com.intuitivedesigns.streamwatch.codec.KeyValueSchema;
import com.intuitivedesigns.streamwatch.core.ConnectionFactory;
import com.intuitivedesigns.streamwatch.core.ConnectionHandle;
import com.intuitivedesigns.streamwatch.core.ConnectionListener;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Subscribes one consumer per connection.
 *
 * <p>The schemas are loaded on the first open and reused afterwards, so a schema that cannot be
 * fetched fails the source at start-up instead of on a later reconnect.</p>
 */
public final class PulsarConsumerFactory implements ConnectionFactory<Message<byte[]>> {

    private static final Logger log = LoggerFactory.getLogger(PulsarConsumerFactory.class);

    private final String topic;
    private final ConsumerOpener opener;
    private final SchemaLoader schemaLoader;
    private final Duration pollTimeout;
    private final boolean autoAck;

    private volatile KeyValueSchema schema;
    private volatile Consumer<byte[]> active;

    public PulsarConsumerFactory(String topic,
                                 ConsumerOpener opener,
                                 SchemaLoader schemaLoader,
                                 Duration pollTimeout,
                                 boolean autoAck) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.opener = Objects.requireNonNull(opener, "opener");
        this.schemaLoader = Objects.requireNonNull(schemaLoader, "schemaLoader");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        this.autoAck = autoAck;
    }

    @Override
    public ConnectionHandle<Message<byte[]>> open(ConnectionListener<Message<byte[]>> listener) throws Exception {
        if (schema == null) {
            KeyValueSchema loaded = schemaLoader.load();
            if (loaded == null) {
                throw new IllegalStateException("Cannot locate the schema for topic " + topic);
            }
            schema = loaded;
        }

        log.info("🔌 Subscribing to Pulsar topic: {}", topic);
        Consumer<byte[]> consumer = opener.subscribe();
        active = consumer;
        return new ConsumerConnection(topic, consumer, pollTimeout, autoAck);
    }

    /**
     * @throws IllegalStateException before the first successful open
     */
    public KeyValueSchema schema() {
        KeyValueSchema s = schema;
        if (s == null) throw new IllegalStateException("Schema for " + topic + " not loaded yet");
        return s;
    }

    /**
     * The most recently subscribed consumer, or {@code null} before the first open.
     */
    Consumer<byte[]> activeConsumer() {
        return active;
    }

    public boolean autoAck() {
        return autoAck;
    }
}
