/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.config;

import com.intuitivedesigns.streamwatch.core.EventSource;
import com.intuitivedesigns.streamwatch.metrics.MetricsRuntime;
import com.intuitivedesigns.streamwatch.spi.ServicePluginRegistry;
import com.intuitivedesigns.streamwatch.spi.SourcePlugin;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SourceFactoryTest {

    @Test
    void resolvesPluginByNormalizedId() throws Exception {
        SourcePlugin plugin = mock(SourcePlugin.class);
        EventSource<?> source = mock(EventSource.class);
        when(plugin.id()).thenReturn("REDIS_STREAM");
        doReturnSource(plugin, source);

        ServicePluginRegistry<SourcePlugin> registry = new ServicePluginRegistry<>(SourcePlugin.class, List.of(plugin));
        WatchConfig config = WatchConfig.of(Map.of("source.type", "redis-stream"));

        assertSame(source, SourceFactory.createSource(registry, config, MetricsRuntime.NOOP));
    }

    @Test
    void missingTypeNamesTheKey() {
        ServicePluginRegistry<SourcePlugin> registry = new ServicePluginRegistry<>(SourcePlugin.class, List.of());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SourceFactory.createSource(registry, WatchConfig.of(Map.of()), MetricsRuntime.NOOP));
        assertTrue(e.getMessage().contains("source.type"));
    }

    @Test
    void unknownTypeListsAvailableOptions() throws Exception {
        SourcePlugin plugin = mock(SourcePlugin.class);
        when(plugin.id()).thenReturn("PULSAR");
        ServicePluginRegistry<SourcePlugin> registry = new ServicePluginRegistry<>(SourcePlugin.class, List.of(plugin));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SourceFactory.createSource(registry, WatchConfig.of(Map.of("source.type", "KAFKA")), MetricsRuntime.NOOP));
        assertTrue(e.getMessage().contains("PULSAR"));
    }

    @Test
    void pluginFailureIsWrappedWithItsId() throws Exception {
        SourcePlugin plugin = mock(SourcePlugin.class);
        when(plugin.id()).thenReturn("WEBSOCKET");
        when(plugin.create(any(), any())).thenThrow(new java.io.IOException("no route"));
        ServicePluginRegistry<SourcePlugin> registry = new ServicePluginRegistry<>(SourcePlugin.class, List.of(plugin));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> SourceFactory.createSource(registry, WatchConfig.of(Map.of("source.type", "WEBSOCKET")), MetricsRuntime.NOOP));
        assertTrue(e.getMessage().contains("WEBSOCKET"));
        assertEquals("no route", e.getCause().getMessage());
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static void doReturnSource(SourcePlugin plugin, EventSource<?> source) throws Exception {
        when(plugin.create(any(), any())).thenReturn((EventSource) source);
    }
}
