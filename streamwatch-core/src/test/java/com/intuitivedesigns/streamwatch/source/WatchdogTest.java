/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.source;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class WatchdogTest {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void rearmsAfterEveryTickEvenWhenTheCheckThrows() {
        AtomicInteger runs = new AtomicInteger();
        Watchdog watchdog = new Watchdog(scheduler, Duration.ofMillis(10), () -> {
            runs.incrementAndGet();
            throw new IllegalStateException("check blew up");
        });
        watchdog.arm();

        await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() >= 3);
        assertTrue(watchdog.ticks() >= 3);
        watchdog.cancel();
    }

    @Test
    void cancelStopsTicking() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        Watchdog watchdog = new Watchdog(scheduler, Duration.ofMillis(10), runs::incrementAndGet);
        watchdog.arm();
        await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() >= 1);

        watchdog.cancel();
        Thread.sleep(30);
        int after = runs.get();
        Thread.sleep(60);
        assertEquals(after, runs.get());
    }

    @Test
    void zeroIntervalDisables() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        Watchdog watchdog = new Watchdog(scheduler, Duration.ZERO, runs::incrementAndGet);
        assertFalse(watchdog.enabled());
        watchdog.arm();
        Thread.sleep(30);
        assertEquals(0, runs.get());
    }

    @Test
    void silenceCountsFromLastMarkAlive() throws Exception {
        Watchdog watchdog = new Watchdog(scheduler, Duration.ofSeconds(1), () -> {});
        assertEquals(Duration.ZERO, watchdog.silence());
        watchdog.markAlive();
        Thread.sleep(30);
        assertTrue(watchdog.silence().toMillis() >= 30);
        watchdog.markAlive();
        assertTrue(watchdog.silence().toMillis() < 30);
    }
}
