/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Metrics bridge for Micrometer.
 *
 * Features:
 * - Composite registry, so exporters can be attached with {@link #addRegistry(MeterRegistry)}
 * - Tag pairs passed straight through to Micrometer
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry;

    public MicrometerMetricsRuntime() {
        this.registry = new CompositeMeterRegistry();
        // In-memory registry so metrics are readable without an exporter
        this.registry.add(new SimpleMeterRegistry());
        log.info("Metrics Runtime Initialized (Type: MICROMETER)");
    }

    public void addRegistry(MeterRegistry specificRegistry) {
        this.registry.add(specificRegistry);
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void counter(String name, double increment, String... tags) {
        if (increment > 0) {
            registry.counter(name, Tags.of(tags)).increment(increment);
        }
    }

    @Override
    public void timer(String name, long durationMillis, String... tags) {
        registry.timer(name, Tags.of(tags)).record(Math.max(0L, durationMillis), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics Runtime Closed.");
    }
}
