/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Properties-backed configuration.
 *
 * <p>The process-wide instance ({@link #get()}) loads from {@code -Dsw.config.path} or the
 * {@code SW_CONFIG_PATH} environment variable. Embedders and tests build their own
 * instance with {@link #of(Properties)}.</p>
 *
 * <p>Secrets are not expected in the file. {@link #getDomainEnv(String)} reads
 * {@code <APP_NAME>__<VAR>} from the environment, where {@code APP_NAME} is the upper-cased
 * {@code app.name} property.</p>
 */
public final class WatchConfig {

    private static final Logger log = LoggerFactory.getLogger(WatchConfig.class);

    public static final String KEY_APP_NAME = "app.name";
    private static final String DEFAULT_APP_NAME = "streamwatch";

    private static volatile WatchConfig instance;

    private final Properties props;
    private final Function<String, String> env;

    private WatchConfig(Properties props, Function<String, String> env) {
        this.props = props;
        this.env = env;
    }

    /**
     * Lazily loaded process-wide configuration.
     */
    public static WatchConfig get() {
        WatchConfig local = instance;
        if (local == null) {
            synchronized (WatchConfig.class) {
                local = instance;
                if (local == null) {
                    local = new WatchConfig(loadFromDisk(), System::getenv);
                    instance = local;
                }
            }
        }
        return local;
    }

    public static WatchConfig of(Properties props) {
        return of(props, System::getenv);
    }

    public static WatchConfig of(Properties props, Function<String, String> env) {
        Objects.requireNonNull(props, "props");
        Objects.requireNonNull(env, "env");
        Properties copy = new Properties();
        copy.putAll(props);
        return new WatchConfig(copy, env);
    }

    public static WatchConfig of(Map<String, String> values) {
        Properties p = new Properties();
        p.putAll(values);
        return of(p);
    }

    private static Properties loadFromDisk() {
        Properties props = new Properties();

        // 1. System Property first (-Dsw.config.path)
        String path = System.getProperty("sw.config.path");

        // 2. Fallback to Environment Variable
        if (path == null || path.isBlank()) {
            path = System.getenv("SW_CONFIG_PATH");
        }

        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified. Usage: -Dsw.config.path=/path/to/config.properties");
            return props;
        }

        log.info("Loading configuration from: {}", path);
        try (InputStream is = new FileInputStream(path)) {
            props.load(is);
            log.info("Loaded {} properties.", props.size());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load config file: " + path, e);
        }
        return props;
    }

    // --- Typed Getters ---

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public String require(String key) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) {
            throw new IllegalArgumentException("Missing config: " + key);
        }
        return val.trim();
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for '{}': '{}'. Using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for '{}': '{}'. Using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Double.parseDouble(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid double for '{}': '{}'. Using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    /**
     * Reads a millisecond value as a {@link Duration}.
     */
    public Duration getDurationMs(String key, Duration defaultValue) {
        long ms = getLong(key, -1L);
        return ms < 0 ? defaultValue : Duration.ofMillis(ms);
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    // --- Environment ---

    public String appName() {
        return getString(KEY_APP_NAME, DEFAULT_APP_NAME);
    }

    /**
     * Reads an environment variable bound to this application, or "" when unset.
     */
    public String getDomainEnv(String varName) {
        String value = env.apply(domainEnvPrefix() + varName);
        return value == null ? "" : value;
    }

    public String domainEnvPrefix() {
        return appName().toUpperCase(Locale.ROOT).replace('-', '_') + "__";
    }
}
