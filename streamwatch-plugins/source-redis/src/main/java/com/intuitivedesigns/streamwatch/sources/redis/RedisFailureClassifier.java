/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.redis;

import com.intuitivedesigns.streamwatch.core.FailureClassification;
import com.intuitivedesigns.streamwatch.core.FailureClassifier;
import redis.clients.jedis.exceptions.JedisConnectionException;

/**
 * Lost or refused connections are retriable. Server replies such as {@code WRONGTYPE} or
 * {@code NOAUTH} ({@code JedisDataException}) and everything else are fatal.
 */
public final class RedisFailureClassifier implements FailureClassifier {

    @Override
    public FailureClassification classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof JedisConnectionException) return FailureClassification.RETRIABLE;
        }
        return FailureClassification.FATAL;
    }
}
