/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.core;

import java.time.Duration;

/**
 * A running external event subscription, republished as an {@link EventStream}.
 *
 * @param <E> element type
 */
public interface EventSource<E> extends AutoCloseable {

    /** Descriptive name used in logs and metrics (topic, namespace/kind, URL, stream key). */
    String name();

    /**
     * Opens the first connection and begins delivery.
     *
     * @throws IllegalStateException if already started
     */
    void start();

    /**
     * Stops delivery, disposes the connection and completes the stream without error.
     * Idempotent.
     */
    void cancel();

    EventStream<E> events();

    /**
     * Waits until the source has failed or completed and released its resources.
     *
     * @return false on timeout
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    /**
     * Cancels the source.
     */
    @Override
    default void close() {
        cancel();
    }
}
