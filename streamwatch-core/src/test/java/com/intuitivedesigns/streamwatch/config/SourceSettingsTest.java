/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.config;

import com.intuitivedesigns.streamwatch.core.OverflowPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceSettingsTest {

    private static final Duration WATCHDOG = Duration.ofSeconds(5);
    private static final Duration IDLE = Duration.ofSeconds(10);

    @Test
    void defaultsApplyWhenKeysAreAbsent() {
        SourceSettings s = SourceSettings.fromConfig(WatchConfig.of(Map.of()), WATCHDOG, IDLE);

        assertEquals(256, s.capacity());
        assertEquals(OverflowPolicy.FAIL, s.overflowPolicy());
        assertEquals(Duration.ofSeconds(1), s.backoffPolicy().delayFor(1));
        assertEquals(Duration.ofSeconds(2), s.backoffPolicy().delayFor(2));
        assertEquals(Duration.ofSeconds(30), s.backoffPolicy().delayFor(20));
        assertEquals(0, s.maxAttempts());
        assertEquals(Duration.ZERO, s.maxRetryDuration());
        assertEquals(WATCHDOG, s.watchdogInterval());
        assertEquals(IDLE, s.idleInterval());
    }

    @Test
    void keysOverrideDefaults() {
        WatchConfig config = WatchConfig.of(Map.of(
                "source.buffer.capacity", "16",
                "source.buffer.overflow", "drop-oldest",
                "source.backoff.type", "FIXED",
                "source.backoff.base.ms", "250",
                "source.backoff.max.attempts", "7",
                "source.backoff.max.duration.ms", "60000",
                "source.watchdog.interval.ms", "0",
                "source.idle.interval.ms", "100"));

        SourceSettings s = SourceSettings.fromConfig(config, WATCHDOG, IDLE);

        assertEquals(16, s.capacity());
        assertEquals(OverflowPolicy.DROP_OLDEST, s.overflowPolicy());
        assertEquals(Duration.ofMillis(250), s.backoffPolicy().delayFor(5));
        assertEquals(7, s.maxAttempts());
        assertEquals(Duration.ofMinutes(1), s.maxRetryDuration());
        assertEquals(Duration.ZERO, s.watchdogInterval());
        assertEquals(Duration.ofMillis(100), s.idleInterval());
    }

    @Test
    void backpressureIsRejected() {
        WatchConfig config = WatchConfig.of(Map.of("source.buffer.overflow", "BACKPRESSURE"));
        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class,
                () -> SourceSettings.fromConfig(config, WATCHDOG, IDLE));
        assertEquals("Overflow policy BACKPRESSURE is not supported", e.getMessage());
    }

    @Test
    void zeroCapacityIsRejected() {
        WatchConfig config = WatchConfig.of(Map.of("source.buffer.capacity", "0"));
        assertThrows(IllegalArgumentException.class, () -> SourceSettings.fromConfig(config, WATCHDOG, IDLE));
    }
}
