/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.metrics;

import com.intuitivedesigns.streamwatch.config.WatchConfig;
import com.intuitivedesigns.streamwatch.spi.PluginIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Picks the metrics runtime named by {@code metrics.type}.
 */
public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    public static final String KEY_METRICS_TYPE = "metrics.type";

    private MetricsFactory() {}

    public static MetricsRuntime init(WatchConfig config) {
        Objects.requireNonNull(config, "config");

        final String type = PluginIds.normalize(config.getString(KEY_METRICS_TYPE, "NOOP"));
        switch (type) {
            case "MICROMETER":
                return new MicrometerMetricsRuntime();
            case "NOOP":
            case "":
                log.info("Metrics disabled (NOOP active).");
                return MetricsRuntime.NOOP;
            default:
                log.warn("Unknown {}='{}'. Metrics disabled (NOOP active).", KEY_METRICS_TYPE, type);
                return MetricsRuntime.NOOP;
        }
    }
}
