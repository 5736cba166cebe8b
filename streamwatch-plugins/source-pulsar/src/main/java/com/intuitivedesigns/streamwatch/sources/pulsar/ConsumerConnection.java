/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.pulsar;

import com.intuitivedesigns.streamwatch.core.ConnectionHandle;
import com.intuitivedesigns.streamwatch.core.DeliveryMode;
import com.intuitivedesigns.streamwatch.core.ReceiveResult;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.PulsarClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Pull-style handle over one subscribed consumer.
 *
 * <p>The subscription is durable: closing the consumer keeps its cursor so the replacement
 * resumes where this one stopped. {@link #terminate()} unsubscribes first, so a cancelled source
 * leaves no backlog accumulating on the broker.</p>
 */
final class ConsumerConnection implements ConnectionHandle<Message<byte[]>> {

    private static final Logger log = LoggerFactory.getLogger(ConsumerConnection.class);

    private final String topic;
    private final Consumer<byte[]> consumer;
    private final int pollTimeoutMs;
    private final boolean autoAck;

    ConsumerConnection(String topic, Consumer<byte[]> consumer, Duration pollTimeout, boolean autoAck) {
        this.topic = topic;
        this.consumer = consumer;
        this.pollTimeoutMs = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, pollTimeout.toMillis()));
        this.autoAck = autoAck;
    }

    @Override
    public DeliveryMode mode() {
        return DeliveryMode.PULL;
    }

    @Override
    public ReceiveResult<Message<byte[]>> receive() throws PulsarClientException {
        if (consumer.hasReachedEndOfTopic()) return ReceiveResult.empty();

        Message<byte[]> msg = consumer.receive(pollTimeoutMs, TimeUnit.MILLISECONDS);
        if (msg == null) return ReceiveResult.empty();

        if (autoAck) {
            consumer.acknowledge(msg);
        }
        return ReceiveResult.event(msg);
    }

    @Override
    public boolean isActive() {
        return consumer.isConnected();
    }

    @Override
    public void close() {
        log.info("🔌 Closing Pulsar consumer on {}", topic);
        try {
            consumer.close();
        } catch (PulsarClientException e) {
            log.warn("Error closing consumer on {}", topic, e);
        }
    }

    @Override
    public void terminate() {
        log.info("Unsubscribing Pulsar consumer {} from {}", consumer.getSubscription(), topic);
        try {
            consumer.unsubscribe();
        } catch (PulsarClientException e) {
            log.warn("Error unsubscribing from {}", topic, e);
        }
        close();
    }
}
