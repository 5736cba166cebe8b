/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.source;

import com.intuitivedesigns.streamwatch.core.OverflowPolicy;
import com.intuitivedesigns.streamwatch.metrics.MetricsRuntime;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Records lifecycle points as counters tagged with the source name.
 */
public final class MetricsSourceListener implements SourceListener {

    public static final String EVENTS = "source.events";
    public static final String RECONNECTS = "source.reconnects";
    public static final String STALLS = "source.stalls";
    public static final String DROPPED = "source.dropped";
    public static final String FAILURES = "source.failures";
    public static final String BACKOFF = "source.backoff";

    private static final String TAG_SOURCE = "source";

    private final MetricsRuntime metrics;

    public MetricsSourceListener(MetricsRuntime metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void onEvent(String source) {
        metrics.counter(EVENTS, TAG_SOURCE, source);
    }

    @Override
    public void onReconnectScheduled(String source, int attempt, Duration delay, Throwable cause) {
        metrics.counter(RECONNECTS, TAG_SOURCE, source);
        metrics.timer(BACKOFF, delay.toMillis(), TAG_SOURCE, source);
    }

    @Override
    public void onStallDetected(String source, String reason) {
        metrics.counter(STALLS, TAG_SOURCE, source);
    }

    @Override
    public void onDropped(String source, OverflowPolicy policy) {
        metrics.counter(DROPPED, TAG_SOURCE, source, "policy", policy.name().toLowerCase(Locale.ROOT));
    }

    @Override
    public void onFailed(String source, Throwable cause) {
        metrics.counter(FAILURES, TAG_SOURCE, source, "cause", cause == null ? "unknown" : cause.getClass().getSimpleName());
    }
}
