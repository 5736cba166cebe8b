/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.websocket;

import com.intuitivedesigns.streamwatch.core.EventDecodeException;
import com.intuitivedesigns.streamwatch.core.EventDecoder;
import com.intuitivedesigns.streamwatch.core.ReceiveResult;

import java.util.Objects;

/**
 * Bytes to a transport message, then the transport message to the emitted element.
 *
 * @param <M> transport message (e.g. {@link PulsarWebSocketMessage})
 * @param <E> emitted element
 */
public final class TwoStageDecoder<M, E> implements EventDecoder<byte[], E> {

    @FunctionalInterface
    public interface MessageDecoder<M> {
        M decode(byte[] bytes) throws Exception;
    }

    @FunctionalInterface
    public interface MessageConverter<M, E> {
        E convert(M message) throws Exception;
    }

    private final MessageDecoder<M> messageDecoder;
    private final MessageConverter<M, E> messageConverter;

    public TwoStageDecoder(MessageDecoder<M> messageDecoder, MessageConverter<M, E> messageConverter) {
        this.messageDecoder = Objects.requireNonNull(messageDecoder, "messageDecoder");
        this.messageConverter = Objects.requireNonNull(messageConverter, "messageConverter");
    }

    /**
     * An empty frame carries nothing to emit.
     */
    @Override
    public ReceiveResult<E> decode(byte[] raw) throws EventDecodeException {
        if (raw == null || raw.length == 0) return ReceiveResult.empty();

        M message;
        try {
            message = messageDecoder.decode(raw);
        } catch (EventDecodeException e) {
            throw e;
        } catch (Exception e) {
            throw new EventDecodeException("Could not decode a " + raw.length + "-byte frame", e);
        }
        if (message == null) return ReceiveResult.empty();

        try {
            E element = messageConverter.convert(message);
            return element == null ? ReceiveResult.empty() : ReceiveResult.event(element);
        } catch (EventDecodeException e) {
            throw e;
        } catch (Exception e) {
            throw new EventDecodeException("Could not convert message " + message, e);
        }
    }
}
