/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.spi;

import com.intuitivedesigns.streamwatch.config.WatchConfig;
import com.intuitivedesigns.streamwatch.core.EventSource;
import com.intuitivedesigns.streamwatch.metrics.MetricsRuntime;

/**
 * SPI definition for transport sources, discovered through {@code META-INF/services}.
 *
 * <p>{@link #create} builds the source but does not start it; opening the first connection is
 * the caller's decision.</p>
 */
public interface SourcePlugin extends ServicePlugin {

    @Override
    String id(); // e.g. "KUBERNETES", "PULSAR", "WEBSOCKET", "REDIS_STREAM"

    EventSource<?> create(WatchConfig config, MetricsRuntime metrics) throws Exception;
}
