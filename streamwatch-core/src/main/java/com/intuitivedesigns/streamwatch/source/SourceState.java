/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.source;

/**
 * Lifecycle of a {@link ResilientSource}. {@link #FAILED} and {@link #COMPLETED} are terminal.
 */
public enum SourceState {
    IDLE,
    CONNECTED,
    RECONNECTING,
    FAILED,
    COMPLETED;

    public boolean isTerminal() {
        return this == FAILED || this == COMPLETED;
    }
}
