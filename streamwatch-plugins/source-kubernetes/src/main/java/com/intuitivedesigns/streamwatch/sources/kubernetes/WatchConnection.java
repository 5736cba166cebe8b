/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.kubernetes;

import com.intuitivedesigns.streamwatch.core.ConnectionHandle;
import com.intuitivedesigns.streamwatch.core.ConnectionListener;
import com.intuitivedesigns.streamwatch.core.DeliveryMode;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A live watch. fabric8 calls back from its own threads; everything is forwarded to the
 * source's listener, which marshals it onto the scheduler.
 *
 * <p>Counts as alive while its watch is being opened. Once closed (by the server or by
 * {@link #close()}) or failed to open, the connection reports itself inactive. A close we
 * initiated is not echoed back to the listener, and a watch that opens after it is closed.</p>
 */
final class WatchConnection<T> implements ConnectionHandle<ResourceEvent<T>>, Watcher<T> {

    private static final Logger log = LoggerFactory.getLogger(WatchConnection.class);

    private final String description;
    private final ConnectionListener<ResourceEvent<T>> listener;

    private volatile Watch watch;
    private volatile boolean remoteClosed;
    private volatile boolean openFailed;
    private volatile boolean disposed;

    WatchConnection(String description, ConnectionListener<ResourceEvent<T>> listener) {
        this.description = description;
        this.listener = listener;
    }

    // --- Opening (open executor) ---

    void attach(Watch watch) {
        if (watch == null) {
            openFailed(new IllegalStateException("Watch opener returned null for " + description));
            return;
        }
        this.watch = watch;
        if (disposed) closeQuietly(watch);
    }

    void openFailed(RuntimeException error) {
        openFailed = true;
        if (disposed) return;
        log.warn("Opening watch on {} failed: {}", description, error.toString());
        listener.onError(error);
    }

    boolean isDisposed() {
        return disposed;
    }

    // --- Watcher (fabric8 threads) ---

    @Override
    public void eventReceived(Action action, T resource) {
        if (disposed || resource == null) return;
        listener.onMessage(new ResourceEvent<>(action, resource));
    }

    @Override
    public void onClose(WatcherException cause) {
        remoteClosed = true;
        if (disposed) return;
        listener.onError(cause);
    }

    @Override
    public void onClose() {
        remoteClosed = true;
        if (disposed) return;
        listener.onClose();
    }

    // --- ConnectionHandle (scheduler thread) ---

    @Override
    public DeliveryMode mode() {
        return DeliveryMode.PUSH;
    }

    @Override
    public boolean isActive() {
        return !remoteClosed && !openFailed && !disposed;
    }

    @Override
    public void close() {
        if (disposed) return;
        disposed = true;
        Watch w = watch;
        if (w != null) closeQuietly(w);
    }

    private void closeQuietly(Watch w) {
        try {
            w.close();
        } catch (RuntimeException e) {
            log.warn("Error closing watch on {}", description, e);
        }
    }
}
