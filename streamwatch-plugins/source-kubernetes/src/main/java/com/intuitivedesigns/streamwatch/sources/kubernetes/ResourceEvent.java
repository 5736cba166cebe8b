/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.kubernetes;

import io.fabric8.kubernetes.client.Watcher;

import java.util.Objects;

/**
 * One notification from a Kubernetes watch.
 *
 * @param action ADDED, MODIFIED, DELETED, BOOKMARK or ERROR
 * @param resource the object as the API server reported it
 */
public record ResourceEvent<T>(Watcher.Action action, T resource) {

    public ResourceEvent {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(resource, "resource");
    }
}
