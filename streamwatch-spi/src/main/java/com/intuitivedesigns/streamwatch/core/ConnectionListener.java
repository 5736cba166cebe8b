/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.core;

/**
 * Callbacks a push-style transport uses to report activity.
 *
 * <p>May be invoked from any thread. The source marshals each call onto its own scheduler and
 * ignores calls from a connection it has already replaced.</p>
 *
 * @param <R> raw message type
 */
public interface ConnectionListener<R> {

    void onMessage(R raw);

    void onError(Throwable error);

    /**
     * The remote side ended the subscription without an error.
     */
    void onClose();
}
