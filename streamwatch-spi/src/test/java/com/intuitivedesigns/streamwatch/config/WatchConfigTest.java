/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class WatchConfigTest {

    @Test
    void typedGettersFallBackOnInvalidValues() {
        WatchConfig config = WatchConfig.of(Map.of(
                "a.int", "12",
                "a.bad", "twelve",
                "a.long", " 9000000000 ",
                "a.double", "1.5",
                "a.bool", "TRUE"));

        assertEquals(12, config.getInt("a.int", 0));
        assertEquals(7, config.getInt("a.bad", 7));
        assertEquals(9_000_000_000L, config.getLong("a.long", 0));
        assertEquals(1.5, config.getDouble("a.double", 0.0));
        assertEquals(3.0, config.getDouble("a.bad", 3.0));
        assertTrue(config.getBoolean("a.bool", false));
        assertTrue(config.getBoolean("missing", true));
    }

    @Test
    void durationsAreMilliseconds() {
        WatchConfig config = WatchConfig.of(Map.of("w.ms", "1500"));
        assertEquals(Duration.ofMillis(1500), config.getDurationMs("w.ms", Duration.ZERO));
        assertEquals(Duration.ofSeconds(5), config.getDurationMs("other.ms", Duration.ofSeconds(5)));
    }

    @Test
    void requireNamesTheMissingKey() {
        WatchConfig config = WatchConfig.of(Map.of("blank", "  "));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> config.require("source.type"));
        assertEquals("Missing config: source.type", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> config.require("blank"));
    }

    @Test
    void domainEnvUsesAppNamePrefix() {
        Properties p = new Properties();
        p.setProperty("app.name", "cluster-watch");
        Map<String, String> env = Map.of("CLUSTER_WATCH__WSS_TOKEN", "secret");
        WatchConfig config = WatchConfig.of(p, env::get);

        assertEquals("CLUSTER_WATCH__", config.domainEnvPrefix());
        assertEquals("secret", config.getDomainEnv("WSS_TOKEN"));
        assertEquals("", config.getDomainEnv("WSS_HEADER"));
    }

    @Test
    void copiesInputProperties() {
        Properties p = new Properties();
        p.setProperty("k", "v1");
        WatchConfig config = WatchConfig.of(p);
        p.setProperty("k", "v2");

        assertEquals("v1", config.getString("k", null));
        assertTrue(config.hasPath("k"));
        assertEquals("streamwatch", config.appName());
    }
}
