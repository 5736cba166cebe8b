/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.metrics;

/**
 * Vendor-agnostic metrics contract.
 *
 * <p>Every method has a no-op default so sources and plugins can record unconditionally.
 * Tags are flat key/value pairs: {@code counter("source.events", "source", "orders")}.</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    MetricsRuntime NOOP = new MetricsRuntime() {};

    /**
     * The underlying registry (a Micrometer {@code MeterRegistry} when enabled), or {@code null}.
     */
    default Object registry() { return null; }

    default boolean enabled() { return false; }

    default String type() { return "NOOP"; }

    // --- Instrumentation (NOOP defaults) ---

    default void counter(String name, String... tags) { counter(name, 1.0, tags); }

    default void counter(String name, double increment, String... tags) {}

    default void timer(String name, long durationMillis, String... tags) {}

    @Override
    default void close() {
        // no-op by default
    }
}
