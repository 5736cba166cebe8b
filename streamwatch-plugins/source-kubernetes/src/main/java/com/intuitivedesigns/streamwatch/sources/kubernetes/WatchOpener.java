/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.kubernetes;

import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;

/**
 * Registers a watcher against the API server, e.g.
 * {@code w -> client.pods().inNamespace(ns).watch(w)}.
 */
@FunctionalInterface
public interface WatchOpener<T> {

    Watch open(Watcher<T> watcher);
}
