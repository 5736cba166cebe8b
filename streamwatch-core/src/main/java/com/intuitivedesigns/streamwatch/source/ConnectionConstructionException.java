/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.source;

/**
 * The connection factory failed while the source was starting. Treated as a configuration
 * error and never retried.
 */
public class ConnectionConstructionException extends RuntimeException {

    private final String sourceName;

    public ConnectionConstructionException(String sourceName, Throwable cause) {
        super("Could not open initial connection for '" + sourceName + "': "
                + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.sourceName = sourceName;
    }

    public String sourceName() {
        return sourceName;
    }
}
