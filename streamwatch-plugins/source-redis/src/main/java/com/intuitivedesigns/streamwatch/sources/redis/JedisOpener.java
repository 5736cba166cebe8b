/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.redis;

import redis.clients.jedis.Jedis;

/**
 * Borrows one connection, typically {@code JedisPool::getResource}.
 */
@FunctionalInterface
public interface JedisOpener {
    Jedis open();
}
