/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.pulsar;

import com.intuitivedesigns.streamwatch.core.EventSource;
import com.intuitivedesigns.streamwatch.core.EventStream;
import com.intuitivedesigns.streamwatch.source.ResilientSource;
import com.intuitivedesigns.streamwatch.source.SourceState;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.MessageId;
import org.apache.pulsar.client.api.PulsarClientException;

import java.time.Duration;
import java.util.Objects;

/**
 * A resilient Pulsar topic source with explicit acknowledgement.
 *
 * <p>Acknowledgements go to the current consumer of the durable subscription, so ids
 * received before a reconnect can still be acknowledged after it.</p>
 */
public final class PulsarSource implements EventSource<PulsarEvent> {

    private final ResilientSource<?, PulsarEvent> delegate;
    private final PulsarConsumerFactory factory;

    public PulsarSource(ResilientSource<?, PulsarEvent> delegate, PulsarConsumerFactory factory) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * @throws IllegalStateException when auto-ack is enabled or no consumer is subscribed yet
     */
    public void acknowledge(MessageId messageId) throws PulsarClientException {
        Objects.requireNonNull(messageId, "messageId");
        if (factory.autoAck()) {
            throw new IllegalStateException("Source " + name() + " has automatic acknowledge enabled");
        }
        Consumer<byte[]> consumer = factory.activeConsumer();
        if (consumer == null) {
            throw new IllegalStateException("Source " + name() + " has no subscribed consumer");
        }
        consumer.acknowledge(messageId);
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public void start() {
        delegate.start();
    }

    @Override
    public void cancel() {
        delegate.cancel();
    }

    @Override
    public EventStream<PulsarEvent> events() {
        return delegate.events();
    }

    public SourceState state() {
        return delegate.state();
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return delegate.awaitTermination(timeout);
    }
}
