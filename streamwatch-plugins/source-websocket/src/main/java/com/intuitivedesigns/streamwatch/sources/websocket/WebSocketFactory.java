/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.websocket;

import com.intuitivedesigns.streamwatch.core.ConnectionFactory;
import com.intuitivedesigns.streamwatch.core.ConnectionHandle;
import com.intuitivedesigns.streamwatch.core.ConnectionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Starts one WebSocket handshake per connection and returns without waiting for it.
 *
 * <p>The handshake settles on the client's threads: success attaches the session to the
 * handle, failure or {@code connectTimeout} is reported through the connection listener as a
 * transport error. Only errors raised while starting the handshake (a malformed URI, a null
 * future) escape {@link #open}.</p>
 */
public final class WebSocketFactory implements ConnectionFactory<byte[]> {

    private static final Logger log = LoggerFactory.getLogger(WebSocketFactory.class);

    private final String url;
    private final WebSocketOpener opener;
    private final MessageAcknowledger acknowledger;
    private final Duration connectTimeout;

    /**
     * @param url used in logs
     */
    public WebSocketFactory(String url, WebSocketOpener opener, MessageAcknowledger acknowledger, Duration connectTimeout) {
        this.url = Objects.requireNonNull(url, "url");
        this.opener = Objects.requireNonNull(opener, "opener");
        this.acknowledger = Objects.requireNonNull(acknowledger, "acknowledger");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public ConnectionHandle<byte[]> open(ConnectionListener<byte[]> listener) {
        WebSocketConnection connection = new WebSocketConnection(url, listener, acknowledger);
        log.info("🔌 Connecting to {}", url);
        CompletableFuture<WebSocket> handshake = opener.open(connection);
        if (handshake == null) {
            throw new IllegalStateException("WebSocket opener returned null for " + url);
        }
        handshake.whenComplete(connection::handshakeCompleted);
        // On a copy, so the timeout never completes the client's own future
        handshake.copy()
                .orTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ws, e) -> {
                    if (e instanceof TimeoutException) connection.handshakeTimedOut(connectTimeout);
                });
        return connection;
    }
}
