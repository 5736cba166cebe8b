/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.source;

import com.intuitivedesigns.streamwatch.core.OverflowPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * SLF4J rendition of the lifecycle hook.
 *
 * Features:
 * - WARN on every reconnect with the applied backoff
 * - Drop warnings rate-limited to one line per interval, with the count since the last line
 * - ERROR on terminal failure, always naming the source
 */
public final class LoggingSourceListener implements SourceListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingSourceListener.class);

    private static final long DROP_LOG_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(5);

    private long lastDropLogNanos;
    private long droppedSinceLog;

    @Override
    public void onStarted(String source) {
        log.info("▶️ Starting source '{}'", source);
    }

    @Override
    public void onConnected(String source, long generation) {
        log.info("🔌 Source '{}' connected (generation {})", source, generation);
    }

    @Override
    public void onReconnectScheduled(String source, int attempt, Duration delay, Throwable cause) {
        log.warn("Source '{}' lost its connection ({}). Reconnecting in {}ms (attempt {})",
                source, describe(cause), delay.toMillis(), attempt);
        log.debug("Retriable failure detail for '{}'", source, cause);
    }

    @Override
    public void onStallDetected(String source, String reason) {
        log.warn("Source '{}' recreating connection: {}", source, reason);
    }

    @Override
    public void onDropped(String source, OverflowPolicy policy) {
        droppedSinceLog++;
        long now = System.nanoTime();
        if (lastDropLogNanos == 0L || now - lastDropLogNanos >= DROP_LOG_INTERVAL_NANOS) {
            log.warn("Source '{}' buffer full, dropped {} event(s) ({})", source, droppedSinceLog, policy);
            droppedSinceLog = 0L;
            lastDropLogNanos = now;
        }
    }

    @Override
    public void onFailed(String source, Throwable cause) {
        log.error("❌ Source '{}' failed: {}", source, describe(cause), cause);
    }

    @Override
    public void onCompleted(String source) {
        log.info("🛑 Source '{}' completed", source);
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown";
        String msg = t.getMessage();
        return msg == null ? t.getClass().getSimpleName() : t.getClass().getSimpleName() + ": " + msg;
    }
}
