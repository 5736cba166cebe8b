/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.core;

/**
 * What a source does with an error raised by its connection.
 */
public enum FailureClassification {
    /** Dispose the connection, back off, reconnect. Never terminates the source on its own. */
    RETRIABLE,
    /** Dispose the connection and fail the source. */
    FATAL
}
