/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.pulsar;

import com.intuitivedesigns.streamwatch.codec.KeyValueSchema;

/**
 * Supplies the topic's key/value schemas, typically from the admin REST API.
 */
@FunctionalInterface
public interface SchemaLoader {

    KeyValueSchema load() throws Exception;
}
