/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.core;

import java.util.Locale;

/**
 * What the bounded emitter does when a new element arrives at full capacity.
 *
 * <p>There is deliberately no blocking variant: watch-style transports cannot pause delivery.
 * Flow control is a small capacity plus {@link #FAIL}.</p>
 */
public enum OverflowPolicy {
    /** Fail the stream. */
    FAIL,
    /** Evict the oldest buffered element to make room. */
    DROP_OLDEST,
    /** Discard the incoming element. */
    DROP_NEWEST;

    /**
     * @throws UnsupportedOperationException for {@code BACKPRESSURE}
     * @throws IllegalArgumentException for anything else unknown
     */
    public static OverflowPolicy parse(String value) {
        String v = value == null ? "" : value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("BACKPRESSURE".equals(v) || "BLOCK".equals(v)) {
            throw new UnsupportedOperationException("Overflow policy " + v + " is not supported");
        }
        try {
            return OverflowPolicy.valueOf(v);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown overflow policy '" + value + "'. Expected one of FAIL, DROP_OLDEST, DROP_NEWEST", e);
        }
    }
}
