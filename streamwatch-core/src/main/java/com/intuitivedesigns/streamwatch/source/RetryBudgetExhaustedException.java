/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.source;

/**
 * Consecutive retriable failures exceeded the configured attempt or duration limit.
 */
public class RetryBudgetExhaustedException extends RuntimeException {

    private final String sourceName;
    private final int attempts;

    public RetryBudgetExhaustedException(String sourceName, int attempts, Throwable lastFailure) {
        super("Source '" + sourceName + "' gave up after " + attempts + " consecutive failures", lastFailure);
        this.sourceName = sourceName;
        this.attempts = attempts;
    }

    public String sourceName() {
        return sourceName;
    }

    public int attempts() {
        return attempts;
    }
}
