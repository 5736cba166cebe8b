/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.config;

import com.intuitivedesigns.streamwatch.core.OverflowPolicy;
import com.intuitivedesigns.streamwatch.source.BackoffPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * The knobs every source shares, bound from {@link WatchConfig}.
 *
 * @param capacity Bounded emitter capacity.
 * @param overflowPolicy What a full emitter does with a new element.
 * @param backoffPolicy Delay between reconnect attempts.
 * @param maxAttempts Consecutive retriable failures tolerated (0 = unbounded).
 * @param maxRetryDuration Failure streak length tolerated (zero = unbounded).
 * @param watchdogInterval Liveness check period (zero = disabled).
 * @param idleInterval Re-poll delay after an empty pull.
 */
public record SourceSettings(
        int capacity,
        OverflowPolicy overflowPolicy,
        BackoffPolicy backoffPolicy,
        int maxAttempts,
        Duration maxRetryDuration,
        Duration watchdogInterval,
        Duration idleInterval
) {

    // Config keys
    public static final String KEY_CAPACITY = "source.buffer.capacity";
    public static final String KEY_OVERFLOW = "source.buffer.overflow";
    public static final String KEY_BACKOFF_TYPE = "source.backoff.type";
    public static final String KEY_BACKOFF_BASE = "source.backoff.base.ms";
    public static final String KEY_BACKOFF_MAX = "source.backoff.max.ms";
    public static final String KEY_BACKOFF_MULTIPLIER = "source.backoff.multiplier";
    public static final String KEY_MAX_ATTEMPTS = "source.backoff.max.attempts";
    public static final String KEY_MAX_DURATION = "source.backoff.max.duration.ms";
    public static final String KEY_WATCHDOG = "source.watchdog.interval.ms";
    public static final String KEY_IDLE = "source.idle.interval.ms";

    // Defaults
    public static final int DEFAULT_CAPACITY = 256;
    private static final String DEFAULT_OVERFLOW = "FAIL";
    private static final String DEFAULT_BACKOFF_TYPE = "EXPONENTIAL";
    private static final long DEFAULT_BACKOFF_BASE_MS = 1_000L;
    private static final long DEFAULT_BACKOFF_MAX_MS = 30_000L;
    private static final double DEFAULT_MULTIPLIER = 2.0;

    public SourceSettings {
        if (capacity <= 0) {
            throw new IllegalArgumentException(KEY_CAPACITY + " must be > 0, got " + capacity);
        }
        Objects.requireNonNull(overflowPolicy, "overflowPolicy");
        Objects.requireNonNull(backoffPolicy, "backoffPolicy");
        if (maxRetryDuration == null) maxRetryDuration = Duration.ZERO;
        if (watchdogInterval == null) watchdogInterval = Duration.ZERO;
        Objects.requireNonNull(idleInterval, "idleInterval");
    }

    /**
     * Binds the common keys, falling back to the transport's own watchdog and idle defaults.
     *
     * @throws UnsupportedOperationException if the overflow policy is {@code BACKPRESSURE}
     */
    public static SourceSettings fromConfig(WatchConfig config, Duration defaultWatchdog, Duration defaultIdle) {
        Objects.requireNonNull(config, "config");

        int capacity = config.getInt(KEY_CAPACITY, DEFAULT_CAPACITY);
        OverflowPolicy overflow = OverflowPolicy.parse(config.getString(KEY_OVERFLOW, DEFAULT_OVERFLOW));

        BackoffPolicy backoff = BackoffPolicy.parse(
                config.getString(KEY_BACKOFF_TYPE, DEFAULT_BACKOFF_TYPE),
                Duration.ofMillis(config.getLong(KEY_BACKOFF_BASE, DEFAULT_BACKOFF_BASE_MS)),
                Duration.ofMillis(config.getLong(KEY_BACKOFF_MAX, DEFAULT_BACKOFF_MAX_MS)),
                config.getDouble(KEY_BACKOFF_MULTIPLIER, DEFAULT_MULTIPLIER));

        return new SourceSettings(
                capacity,
                overflow,
                backoff,
                config.getInt(KEY_MAX_ATTEMPTS, 0),
                config.getDurationMs(KEY_MAX_DURATION, Duration.ZERO),
                config.getDurationMs(KEY_WATCHDOG, defaultWatchdog),
                config.getDurationMs(KEY_IDLE, defaultIdle));
    }
}
