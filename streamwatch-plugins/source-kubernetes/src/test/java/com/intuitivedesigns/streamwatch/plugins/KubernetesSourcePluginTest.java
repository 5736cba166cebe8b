/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.plugins;

import com.intuitivedesigns.streamwatch.config.SourceSettings;
import com.intuitivedesigns.streamwatch.config.WatchConfig;
import com.intuitivedesigns.streamwatch.core.StreamEvent;
import com.intuitivedesigns.streamwatch.metrics.MetricsRuntime;
import com.intuitivedesigns.streamwatch.source.ResilientSource;
import com.intuitivedesigns.streamwatch.sources.kubernetes.ResourceEvent;
import com.intuitivedesigns.streamwatch.spi.ServicePluginRegistry;
import com.intuitivedesigns.streamwatch.spi.SourcePlugin;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class KubernetesSourcePluginTest {

    @Test
    void isDiscoveredThroughServiceLoader() {
        ServicePluginRegistry<SourcePlugin> registry = new ServicePluginRegistry<>(SourcePlugin.class);
        assertTrue(registry.get("kubernetes").isPresent());
    }

    @Test
    void watchdogDefaultsToFiveSeconds() {
        SourceSettings settings = SourceSettings.fromConfig(WatchConfig.of(Map.of()),
                KubernetesSourcePlugin.DEFAULT_WATCHDOG, Duration.ofSeconds(1));
        assertEquals(Duration.ofSeconds(5), settings.watchdogInterval());
    }

    @Test
    void namesTheSourceAfterNamespaceAndKind() {
        WatchConfig config = WatchConfig.of(Map.of(
                "source.kubernetes.namespace", "batch",
                "source.kubernetes.api.version", "batch/v1",
                "source.kubernetes.kind", "Job"));
        KubernetesClient client = mock(KubernetesClient.class);

        ResilientSource<ResourceEvent<GenericKubernetesResource>, StreamEvent<GenericKubernetesResource>> source =
                KubernetesSourcePlugin.build(config, MetricsRuntime.NOOP, settings(config), client);

        assertEquals("kubernetes:batch/Job", source.name());
    }

    @Test
    void failedFirstWatchReleasesTheClient() throws Exception {
        WatchConfig config = WatchConfig.of(Map.of());
        // An unstubbed client returns null for the resource operation
        KubernetesClient client = mock(KubernetesClient.class);

        ResilientSource<ResourceEvent<GenericKubernetesResource>, StreamEvent<GenericKubernetesResource>> source =
                KubernetesSourcePlugin.build(config, MetricsRuntime.NOOP, settings(config), client);
        assertEquals("kubernetes:*/Pod", source.name());

        source.start();
        assertTrue(source.awaitTermination(Duration.ofSeconds(5)));

        // Opened off the scheduler thread, so the failure is classified rather than a construction error
        assertInstanceOf(NullPointerException.class, source.events().failure().orElseThrow());
        verify(client).close();
    }

    private static SourceSettings settings(WatchConfig config) {
        return SourceSettings.fromConfig(config, KubernetesSourcePlugin.DEFAULT_WATCHDOG, Duration.ofSeconds(1));
    }
}
