/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.core;

/**
 * Terminal error seen by a consumer of a failed source.
 */
public class SourceFailedException extends RuntimeException {

    private final String sourceName;

    public SourceFailedException(String sourceName, Throwable cause) {
        super("Source '" + sourceName + "' failed: " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.sourceName = sourceName;
    }

    public String sourceName() {
        return sourceName;
    }
}
