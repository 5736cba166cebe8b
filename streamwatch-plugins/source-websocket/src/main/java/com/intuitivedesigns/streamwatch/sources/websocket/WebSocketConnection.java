/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.websocket;

import com.intuitivedesigns.streamwatch.core.ConnectionHandle;
import com.intuitivedesigns.streamwatch.core.ConnectionListener;
import com.intuitivedesigns.streamwatch.core.DeliveryMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpTimeoutException;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * One WebSocket session.
 *
 * <p>Demand is requested one message at a time. Fragments are collected until the last one
 * arrives and the whole message is forwarded as bytes (text frames as UTF-8). The JDK client
 * invokes the listener methods sequentially, so the reassembly buffers need no locking.</p>
 *
 * <p>The handle exists before its session: until the handshake settles it counts as alive, and
 * a session that arrives after {@link #close()} is aborted.</p>
 */
final class WebSocketConnection implements ConnectionHandle<byte[]>, WebSocket.Listener {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConnection.class);

    private static final long CLOSE_TIMEOUT_MS = 5_000L;

    private final String url;
    private final ConnectionListener<byte[]> listener;
    private final MessageAcknowledger acknowledger;

    private final StringBuilder text = new StringBuilder();
    private final ByteArrayOutputStream binary = new ByteArrayOutputStream();

    private volatile WebSocket webSocket;
    private volatile boolean disposed;
    private volatile boolean handshakeSettled;

    // Sends must not overlap; each one waits for the previous
    private CompletableFuture<WebSocket> sends = CompletableFuture.completedFuture(null);

    WebSocketConnection(String url, ConnectionListener<byte[]> listener, MessageAcknowledger acknowledger) {
        this.url = url;
        this.listener = listener;
        this.acknowledger = acknowledger;
    }

    // --- Handshake (client threads) ---

    void handshakeCompleted(WebSocket ws, Throwable error) {
        if (ws != null) {
            this.webSocket = ws;
            if (disposed) {
                ws.abort();
                return;
            }
        }
        if (!settle()) return;
        if (error != null) {
            handshakeFailed(unwrap(error));
        } else if (ws == null) {
            handshakeFailed(new IllegalStateException("WebSocket handshake with " + url + " completed without a session"));
        }
    }

    void handshakeTimedOut(Duration timeout) {
        if (!settle()) return;
        handshakeFailed(new HttpTimeoutException(
                "WebSocket handshake with " + url + " timed out after " + timeout.toMillis() + "ms"));
    }

    private synchronized boolean settle() {
        if (handshakeSettled) return false;
        handshakeSettled = true;
        return true;
    }

    private void handshakeFailed(Throwable error) {
        if (disposed) return;
        log.warn("WebSocket handshake with {} failed: {}", url, error.toString());
        listener.onError(error);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    // --- WebSocket.Listener (client threads) ---

    @Override
    public void onOpen(WebSocket ws) {
        this.webSocket = ws;
        ws.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
        text.append(data);
        if (last) {
            byte[] message = text.toString().getBytes(StandardCharsets.UTF_8);
            text.setLength(0);
            forward(ws, message);
        }
        ws.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onBinary(WebSocket ws, ByteBuffer data, boolean last) {
        byte[] chunk = new byte[data.remaining()];
        data.get(chunk);
        binary.write(chunk, 0, chunk.length);
        if (last) {
            byte[] message = binary.toByteArray();
            binary.reset();
            forward(ws, message);
        }
        ws.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
        if (!disposed) {
            log.info("{} closed by server ({} {})", url, statusCode, reason);
            listener.onClose();
        }
        return null;
    }

    @Override
    public void onError(WebSocket ws, Throwable error) {
        if (!disposed) listener.onError(error);
    }

    private void forward(WebSocket ws, byte[] message) {
        if (disposed) return;
        listener.onMessage(message);
        Optional<String> ack = acknowledger.ackFrame(message);
        ack.ifPresent(frame -> send(ws, frame));
    }

    private synchronized void send(WebSocket ws, String frame) {
        sends = sends
                .exceptionally(e -> ws)
                .thenCompose(ignored -> ws.sendText(frame, true))
                .whenComplete((w, e) -> {
                    if (e != null) log.warn("Failed to acknowledge message on {}: {}", url, e.toString());
                });
    }

    // --- ConnectionHandle (scheduler thread) ---

    @Override
    public DeliveryMode mode() {
        return DeliveryMode.PUSH;
    }

    @Override
    public boolean isActive() {
        if (disposed) return false;
        WebSocket ws = webSocket;
        if (ws == null) return !handshakeSettled;
        return !ws.isInputClosed();
    }

    @Override
    public void close() {
        if (disposed) return;
        disposed = true;
        WebSocket ws = webSocket;
        if (ws == null || ws.isOutputClosed()) {
            if (ws != null) ws.abort();
            return;
        }
        synchronized (this) {
            sends = sends
                    .exceptionally(e -> ws)
                    .thenCompose(ignored -> ws.sendClose(WebSocket.NORMAL_CLOSURE, "Terminated subscription"))
                    .orTimeout(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                    .whenComplete((w, e) -> {
                        if (e != null) log.warn("Close handshake with {} failed: {}", url, e.toString());
                        ws.abort();
                    });
        }
    }
}
