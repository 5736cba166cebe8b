/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.websocket;

import java.net.http.WebSocket;
import java.util.concurrent.CompletableFuture;

/**
 * Starts the opening handshake, e.g. {@code l -> http.newWebSocketBuilder().buildAsync(uri, l)}.
 */
@FunctionalInterface
public interface WebSocketOpener {

    CompletableFuture<WebSocket> open(WebSocket.Listener listener);
}
