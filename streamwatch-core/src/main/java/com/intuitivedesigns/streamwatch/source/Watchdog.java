/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic liveness check of the current connection.
 *
 * <p>Runs its check on the owning source's scheduler, so a tick never overlaps a pull or a
 * reconnect. Re-arms after every tick whether or not the check acted, until {@link #cancel()}.
 * Does not touch the reconnect budget.</p>
 */
final class Watchdog {

    private static final Logger log = LoggerFactory.getLogger(Watchdog.class);

    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final Runnable check;

    private ScheduledFuture<?> pending;
    private boolean cancelled;
    private long lastLivenessNanos = -1L;
    private long ticks;

    Watchdog(ScheduledExecutorService scheduler, Duration interval, Runnable check) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.interval = interval;
        this.check = Objects.requireNonNull(check, "check");
    }

    boolean enabled() {
        return interval != null && !interval.isZero() && !interval.isNegative();
    }

    void arm() {
        if (cancelled || !enabled()) return;
        pending = scheduler.schedule(this::tick, interval.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void tick() {
        if (cancelled) return;
        ticks++;
        try {
            check.run();
        } catch (RuntimeException e) {
            log.warn("Watchdog check failed", e);
        } finally {
            arm();
        }
    }

    void markAlive() {
        lastLivenessNanos = System.nanoTime();
    }

    /** Time since the connection was last seen alive; zero before the first mark. */
    Duration silence() {
        long last = lastLivenessNanos;
        return last < 0 ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - last);
    }

    long ticks() {
        return ticks;
    }

    void cancel() {
        cancelled = true;
        ScheduledFuture<?> p = pending;
        if (p != null) p.cancel(false);
        pending = null;
    }
}
