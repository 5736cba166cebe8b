/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.core;

/**
 * Opens a new {@link ConnectionHandle}.
 *
 * <p>Push-style handles deliver through {@code listener}; pull-style handles may ignore it.
 * The factory should register and return promptly. Any exception it throws is a construction
 * failure.</p>
 *
 * @param <R> raw message type
 */
@FunctionalInterface
public interface ConnectionFactory<R> {

    ConnectionHandle<R> open(ConnectionListener<R> listener) throws Exception;
}
