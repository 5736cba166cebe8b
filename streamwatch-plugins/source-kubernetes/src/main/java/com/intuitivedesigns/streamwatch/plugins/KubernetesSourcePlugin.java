/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.plugins;

import com.intuitivedesigns.streamwatch.config.SourceSettings;
import com.intuitivedesigns.streamwatch.config.WatchConfig;
import com.intuitivedesigns.streamwatch.core.EventSource;
import com.intuitivedesigns.streamwatch.core.StreamEvent;
import com.intuitivedesigns.streamwatch.metrics.MetricsRuntime;
import com.intuitivedesigns.streamwatch.source.ResilientSource;
import com.intuitivedesigns.streamwatch.sources.kubernetes.KubernetesEventDecoder;
import com.intuitivedesigns.streamwatch.sources.kubernetes.KubernetesFailureClassifier;
import com.intuitivedesigns.streamwatch.sources.kubernetes.KubernetesWatchFactory;
import com.intuitivedesigns.streamwatch.sources.kubernetes.ResourceEvent;
import com.intuitivedesigns.streamwatch.sources.kubernetes.WatchOpener;
import com.intuitivedesigns.streamwatch.spi.SourcePlugin;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Watches one resource kind, in one namespace or cluster-wide.
 *
 * <p>The client is built from the ambient kubeconfig or in-cluster service account.</p>
 */
public final class KubernetesSourcePlugin implements SourcePlugin {

    public static final String ID = "KUBERNETES";

    // Config Keys
    static final String CFG_NAMESPACE = "source.kubernetes.namespace";
    static final String CFG_API_VERSION = "source.kubernetes.api.version";
    static final String CFG_KIND = "source.kubernetes.kind";

    // Defaults
    private static final String DEFAULT_API_VERSION = "v1";
    private static final String DEFAULT_KIND = "Pod";
    static final Duration DEFAULT_WATCHDOG = Duration.ofSeconds(5);
    private static final Duration DEFAULT_IDLE = Duration.ofSeconds(1);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EventSource<StreamEvent<GenericKubernetesResource>> create(WatchConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        SourceSettings settings = SourceSettings.fromConfig(config, DEFAULT_WATCHDOG, DEFAULT_IDLE);
        KubernetesClient client = new KubernetesClientBuilder().build();
        try {
            return build(config, metrics, settings, client);
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
    }

    static ResilientSource<ResourceEvent<GenericKubernetesResource>, StreamEvent<GenericKubernetesResource>> build(
            WatchConfig config, MetricsRuntime metrics, SourceSettings settings, KubernetesClient client) {

        final String namespace = config.getString(CFG_NAMESPACE, "").trim();
        final String apiVersion = config.getString(CFG_API_VERSION, DEFAULT_API_VERSION).trim();
        final String kind = config.getString(CFG_KIND, DEFAULT_KIND).trim();
        final String description = (namespace.isEmpty() ? "*" : namespace) + "/" + kind;

        WatchOpener<GenericKubernetesResource> opener = namespace.isEmpty()
                ? w -> client.genericKubernetesResources(apiVersion, kind).inAnyNamespace().watch(w)
                : w -> client.genericKubernetesResources(apiVersion, kind).inNamespace(namespace).watch(w);

        ExecutorService openExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sw-watch-open-" + description);
            t.setDaemon(true);
            return t;
        });

        return ResilientSource.<ResourceEvent<GenericKubernetesResource>, StreamEvent<GenericKubernetesResource>>builder()
                .name("kubernetes:" + description)
                .connectionFactory(new KubernetesWatchFactory<>(description, opener, openExecutor))
                .decoder(new KubernetesEventDecoder<>())
                .classifier(new KubernetesFailureClassifier())
                .settings(settings)
                .metrics(metrics)
                .closeOnTermination(client)
                .closeOnTermination(openExecutor::shutdownNow)
                .build();
    }
}
