/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.config;

import com.intuitivedesigns.streamwatch.core.EventSource;
import com.intuitivedesigns.streamwatch.metrics.MetricsRuntime;
import com.intuitivedesigns.streamwatch.spi.ServicePluginRegistry;
import com.intuitivedesigns.streamwatch.spi.SourcePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Resolves {@code source.type} against the {@link SourcePlugin}s on the classpath.
 */
public final class SourceFactory {

    private static final Logger log = LoggerFactory.getLogger(SourceFactory.class);

    public static final String KEY_SOURCE_TYPE = "source.type";

    private static final ServicePluginRegistry<SourcePlugin> SOURCES =
            new ServicePluginRegistry<>(SourcePlugin.class, resolveClassLoader());

    private SourceFactory() {}

    public static EventSource<?> createSource(WatchConfig config, MetricsRuntime metrics) {
        return createSource(SOURCES, config, metrics);
    }

    static EventSource<?> createSource(ServicePluginRegistry<SourcePlugin> registry,
                                       WatchConfig config,
                                       MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = config.require(KEY_SOURCE_TYPE);
        final SourcePlugin plugin = registry.require(id, KEY_SOURCE_TYPE);
        return createSafe(plugin, config, metrics);
    }

    public static void logAvailablePlugins() {
        log.info("Plugin Catalog Loaded:");
        log.info("  Sources: {}", SOURCES.availableIds());
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : SourceFactory.class.getClassLoader();
    }

    private static EventSource<?> createSafe(SourcePlugin plugin, WatchConfig config, MetricsRuntime metrics) {
        try {
            EventSource<?> source = plugin.create(config, metrics);
            if (source == null) {
                throw new IllegalStateException("Plugin returned null");
            }
            return source;
        } catch (UnsupportedOperationException | IllegalArgumentException e) {
            // Configuration mistakes surface as-is
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed creating Source [" + plugin.id() + "]", e);
        }
    }
}
