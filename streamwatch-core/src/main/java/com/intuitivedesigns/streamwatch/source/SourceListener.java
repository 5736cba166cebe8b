/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.source;

import com.intuitivedesigns.streamwatch.core.OverflowPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Observability hook for source lifecycle points.
 *
 * <p>Called on the source's scheduler thread; implementations must not block. All methods
 * default to no-ops.</p>
 */
public interface SourceListener {

    SourceListener NOOP = new SourceListener() {};

    default void onStarted(String source) {}

    /**
     * A connection was installed. {@code generation} starts at 1 and grows with every reconnect.
     */
    default void onConnected(String source, long generation) {}

    default void onEvent(String source) {}

    default void onReconnectScheduled(String source, int attempt, Duration delay, Throwable cause) {}

    /**
     * The current connection went quiet (watchdog) or was closed by the remote side and is
     * being replaced without backoff.
     */
    default void onStallDetected(String source, String reason) {}

    default void onDropped(String source, OverflowPolicy policy) {}

    default void onFailed(String source, Throwable cause) {}

    default void onCompleted(String source) {}

    /**
     * Fans out to every listener. A listener that throws is logged and skipped.
     */
    static SourceListener composite(List<SourceListener> listeners) {
        final List<SourceListener> all = List.copyOf(listeners);
        return new SourceListener() {
            private final Logger log = LoggerFactory.getLogger(SourceListener.class);

            private void each(Consumer<SourceListener> call) {
                for (SourceListener l : all) {
                    try {
                        call.accept(l);
                    } catch (RuntimeException e) {
                        log.warn("Source listener {} failed", l.getClass().getName(), e);
                    }
                }
            }

            @Override public void onStarted(String source) { each(l -> l.onStarted(source)); }
            @Override public void onConnected(String source, long generation) { each(l -> l.onConnected(source, generation)); }
            @Override public void onEvent(String source) { each(l -> l.onEvent(source)); }
            @Override public void onReconnectScheduled(String source, int attempt, Duration delay, Throwable cause) {
                each(l -> l.onReconnectScheduled(source, attempt, delay, cause));
            }
            @Override public void onStallDetected(String source, String reason) { each(l -> l.onStallDetected(source, reason)); }
            @Override public void onDropped(String source, OverflowPolicy policy) { each(l -> l.onDropped(source, policy)); }
            @Override public void onFailed(String source, Throwable cause) { each(l -> l.onFailed(source, cause)); }
            @Override public void onCompleted(String source) { each(l -> l.onCompleted(source)); }
        };
    }
}
