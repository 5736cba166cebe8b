/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.metrics;

import com.intuitivedesigns.streamwatch.config.WatchConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsFactoryTest {

    @Test
    void defaultsToNoop() {
        MetricsRuntime rt = MetricsFactory.init(WatchConfig.of(Map.of()));
        assertSame(MetricsRuntime.NOOP, rt);
        assertFalse(rt.enabled());
    }

    @Test
    void micrometerWhenRequested() {
        MetricsRuntime rt = MetricsFactory.init(WatchConfig.of(Map.of("metrics.type", "micrometer")));
        assertInstanceOf(MicrometerMetricsRuntime.class, rt);
        assertEquals("MICROMETER", rt.type());
        rt.close();
    }

    @Test
    void unknownTypeFallsBackToNoop() {
        assertSame(MetricsRuntime.NOOP, MetricsFactory.init(WatchConfig.of(Map.of("metrics.type", "STATSD"))));
    }
}
