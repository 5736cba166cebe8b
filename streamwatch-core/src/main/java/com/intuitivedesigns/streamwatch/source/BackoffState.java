/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.source;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Reconnect budget for one source: consecutive failure count, current delay, and the optional
 * attempt and duration limits.
 *
 * <p>Not thread-safe. Owned by the source's scheduler thread.</p>
 */
public final class BackoffState {

    private final BackoffPolicy policy;
    private final int maxAttempts;          // <= 0: unbounded
    private final Duration maxDuration;     // null or zero: unbounded
    private final LongSupplier nanoClock;

    private int attempts;
    private long streakStartNanos = -1L;

    public BackoffState(BackoffPolicy policy, int maxAttempts, Duration maxDuration) {
        this(policy, maxAttempts, maxDuration, System::nanoTime);
    }

    BackoffState(BackoffPolicy policy, int maxAttempts, Duration maxDuration, LongSupplier nanoClock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.maxAttempts = maxAttempts;
        this.maxDuration = maxDuration;
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /**
     * Records one more retriable failure and returns the delay to wait before reconnecting.
     */
    public Duration advance() {
        if (attempts == 0) {
            streakStartNanos = nanoClock.getAsLong();
        }
        if (attempts < Integer.MAX_VALUE) attempts++;
        return policy.delayFor(attempts);
    }

    /**
     * The delay the next (or, mid-streak, the latest) reconnect waits.
     */
    public Duration currentDelay() {
        return policy.delayFor(Math.max(1, attempts));
    }

    /**
     * True when the failure streak has outrun the attempt or duration limit.
     */
    public boolean isExhausted() {
        if (maxAttempts > 0 && attempts > maxAttempts) return true;
        if (maxDuration != null && !maxDuration.isZero() && streakStartNanos >= 0) {
            return nanoClock.getAsLong() - streakStartNanos >= maxDuration.toNanos();
        }
        return false;
    }

    /**
     * A successfully decoded event ends the failure streak.
     */
    public void reset() {
        attempts = 0;
        streakStartNanos = -1L;
    }

    public int attempts() {
        return attempts;
    }
}
