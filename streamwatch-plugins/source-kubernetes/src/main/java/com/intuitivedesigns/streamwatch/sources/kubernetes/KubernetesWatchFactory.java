/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.kubernetes;

import com.intuitivedesigns.streamwatch.core.ConnectionFactory;
import com.intuitivedesigns.streamwatch.core.ConnectionHandle;
import com.intuitivedesigns.streamwatch.core.ConnectionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Opens one fabric8 watch per connection.
 *
 * <p>fabric8 blocks in {@code watch()} until the server accepts the request, so the opener runs
 * on {@code openExecutor} and {@link #open} returns a handle that is still connecting. A failed
 * open is reported through the connection listener and classified like any other watch error.</p>
 */
public final class KubernetesWatchFactory<T> implements ConnectionFactory<ResourceEvent<T>> {

    private static final Logger log = LoggerFactory.getLogger(KubernetesWatchFactory.class);

    private final String description;
    private final WatchOpener<T> opener;
    private final Executor openExecutor;

    /**
     * @param description namespace/kind, used in logs
     */
    public KubernetesWatchFactory(String description, WatchOpener<T> opener, Executor openExecutor) {
        this.description = Objects.requireNonNull(description, "description");
        this.opener = Objects.requireNonNull(opener, "opener");
        this.openExecutor = Objects.requireNonNull(openExecutor, "openExecutor");
    }

    @Override
    public ConnectionHandle<ResourceEvent<T>> open(ConnectionListener<ResourceEvent<T>> listener) {
        WatchConnection<T> connection = new WatchConnection<>(description, listener);
        log.debug("Opening watch on {}", description);
        openExecutor.execute(() -> {
            if (connection.isDisposed()) return;
            try {
                connection.attach(opener.open(connection));
            } catch (RuntimeException e) {
                connection.openFailed(e);
            }
        });
        return connection;
    }
}
