/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.core;

/**
 * One live subscription to an external resource.
 *
 * <p><b>Ownership:</b> a handle belongs to exactly one source and is only touched from that
 * source's scheduler thread. The source disposes it exactly once: {@link #close()} before it asks
 * the factory for a replacement or after a fatal error, {@link #terminate()} when its consumer
 * cancels.</p>
 *
 * @param <R> raw message type
 */
public interface ConnectionHandle<R> extends AutoCloseable {

    DeliveryMode mode();

    /**
     * Pull-style transports return the next raw message, {@link ReceiveResult#empty()} when
     * nothing is available, or throw. Implementations must bound the wait so cancellation is
     * observed within one poll interval.
     */
    default ReceiveResult<R> receive() throws Exception {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " is push-based");
    }

    /**
     * Transport-specific liveness check used by the watchdog. {@code false} means the handle
     * stopped delivering without raising an error.
     */
    boolean isActive();

    /**
     * Releases every native resource behind this handle. Must not throw.
     */
    @Override
    void close();

    /**
     * Final disposal on cancellation. Transports that keep server-side subscriber state (a
     * durable subscription cursor) drop it here before closing. Must not throw.
     */
    default void terminate() {
        close();
    }
}
