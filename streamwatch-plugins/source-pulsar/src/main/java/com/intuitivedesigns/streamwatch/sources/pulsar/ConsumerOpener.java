/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.pulsar;

import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.PulsarClientException;

/**
 * Subscribes a fresh consumer to the configured topic.
 */
@FunctionalInterface
public interface ConsumerOpener {

    Consumer<byte[]> subscribe() throws PulsarClientException;
}
