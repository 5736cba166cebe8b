/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.source;

/**
 * The consumer fell behind a source configured with {@code OverflowPolicy.FAIL}.
 */
public class EmitterOverflowException extends RuntimeException {

    private final String sourceName;
    private final int capacity;

    public EmitterOverflowException(String sourceName, int capacity) {
        super("Buffer of source '" + sourceName + "' overflowed (capacity " + capacity + ")");
        this.sourceName = sourceName;
        this.capacity = capacity;
    }

    public String sourceName() {
        return sourceName;
    }

    public int capacity() {
        return capacity;
    }
}
