/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.websocket;

import java.util.Optional;

/**
 * Builds the text frame that acknowledges a received message, for protocols that expect one.
 */
@FunctionalInterface
public interface MessageAcknowledger {

    MessageAcknowledger NONE = message -> Optional.empty();

    Optional<String> ackFrame(byte[] message);
}
