/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.app;

import com.intuitivedesigns.streamwatch.config.SourceFactory;
import com.intuitivedesigns.streamwatch.config.WatchConfig;
import com.intuitivedesigns.streamwatch.core.EventSource;
import com.intuitivedesigns.streamwatch.core.SourceFailedException;
import com.intuitivedesigns.streamwatch.metrics.MetricsFactory;
import com.intuitivedesigns.streamwatch.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the configured source and logs every event it delivers.
 *
 * <p>Configuration is read from {@code -Dsw.config.path} (or {@code SW_CONFIG_PATH});
 * {@code source.type} selects the plugin.</p>
 */
public final class WatchApp {

    private static final Logger log = LoggerFactory.getLogger(WatchApp.class);

    // --- Config Keys ---
    private static final String CFG_SHUTDOWN_TIMEOUT_MS = "app.shutdown.timeout.ms";

    // --- Defaults ---
    private static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 10_000L;

    private WatchApp() {}

    public static void main(String[] args) {
        log.info("=== Booting StreamWatch ===");

        final WatchConfig config = WatchConfig.get();
        SourceFactory.logAvailablePlugins();

        MetricsRuntime metrics = null;
        EventSource<?> source = null;
        int exitCode;

        try {
            metrics = MetricsFactory.init(config);
            source = SourceFactory.createSource(config, metrics);

            final Duration shutdownTimeout =
                    config.getDurationMs(CFG_SHUTDOWN_TIMEOUT_MS, Duration.ofMillis(DEFAULT_SHUTDOWN_TIMEOUT_MS));
            Runtime.getRuntime().addShutdownHook(shutdownHook(source, shutdownTimeout));

            exitCode = consume(source);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while consuming");
            exitCode = 1;
        } catch (RuntimeException e) {
            log.error("Fatal application error", e);
            exitCode = 1;
        } finally {
            if (source != null) source.cancel();
            if (metrics != null) metrics.close();
        }

        if (exitCode != 0) System.exit(exitCode);
    }

    /**
     * Starts {@code source} and logs each event on the calling thread until the stream ends.
     *
     * @return 0 when the source completed, 1 when it failed
     */
    static int consume(EventSource<?> source) throws InterruptedException {
        log.info("Starting source '{}'", source.name());
        source.start();

        long delivered = 0;
        try {
            while (true) {
                Optional<?> next = source.events().take();
                if (next.isEmpty()) break;
                delivered++;
                log.info("[{}] {}", source.name(), next.get());
            }
        } catch (SourceFailedException e) {
            log.error("Source '{}' failed after {} events", source.name(), delivered, e.getCause());
            return 1;
        }
        log.info("Source '{}' completed after {} events", source.name(), delivered);
        return 0;
    }

    static Thread shutdownHook(EventSource<?> source, Duration timeout) {
        final AtomicBoolean started = new AtomicBoolean(false);
        return new Thread(() -> {
            if (!started.compareAndSet(false, true)) return;
            log.info("Shutdown signal received. Cancelling '{}'", source.name());
            source.cancel();
            try {
                if (!source.awaitTermination(timeout)) {
                    log.warn("Source '{}' did not terminate within {}ms", source.name(), timeout.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "sw-shutdown");
    }
}
