/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.core;

/**
 * How a {@link ConnectionHandle} hands raw messages to its source.
 */
public enum DeliveryMode {
    /** The transport calls {@link ConnectionListener} from its own threads (watch streams, WebSockets). */
    PUSH,
    /** The source calls {@link ConnectionHandle#receive()} whenever downstream has capacity (consumers, XREAD). */
    PULL
}
