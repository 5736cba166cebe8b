/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.source;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Delay before the n-th consecutive reconnect attempt (1-based).
 *
 * <p>Implementations must be non-decreasing in {@code attempt}.</p>
 */
@FunctionalInterface
public interface BackoffPolicy {

    Duration delayFor(int attempt);

    static BackoffPolicy fixed(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
        return attempt -> delay;
    }

    /**
     * {@code base * multiplier^(attempt-1)}, capped at {@code max}.
     */
    static BackoffPolicy exponential(Duration base, Duration max, double multiplier) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(max, "max");
        if (base.isNegative()) throw new IllegalArgumentException("base must be >= 0");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");

        final long baseMs = base.toMillis();
        final long maxMs = Math.max(baseMs, max.toMillis());
        return attempt -> {
            int n = Math.max(1, attempt);
            double raw = baseMs * Math.pow(multiplier, n - 1);
            // Infinity and NaN clamp to max
            long ms = (raw >= maxMs || Double.isNaN(raw)) ? maxMs : (long) raw;
            return Duration.ofMillis(ms);
        };
    }

    static BackoffPolicy parse(String type, Duration base, Duration max, double multiplier) {
        String t = type == null ? "EXPONENTIAL" : type.trim().toUpperCase(Locale.ROOT);
        switch (t) {
            case "FIXED":
                return fixed(base);
            case "EXPONENTIAL":
                return exponential(base, max, multiplier);
            default:
                throw new IllegalArgumentException("Unknown backoff type '" + type + "'. Expected FIXED or EXPONENTIAL");
        }
    }
}
