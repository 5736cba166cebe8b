/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.core;

/**
 * Maps a raw transport message to an emitted element.
 *
 * <p>Return {@link ReceiveResult#empty()} for "nothing to emit" (keep-alives, end-of-batch
 * markers); never throw for that case. A thrown exception or an {@link ReceiveResult#error}
 * result terminates the source.</p>
 *
 * @param <R> raw message type
 * @param <E> emitted element type
 */
@FunctionalInterface
public interface EventDecoder<R, E> {

    ReceiveResult<E> decode(R raw) throws Exception;

    /**
     * Lifts a plain function into a decoder that always yields an event.
     */
    static <R, E> EventDecoder<R, E> of(java.util.function.Function<R, E> fn) {
        return raw -> ReceiveResult.event(fn.apply(raw));
    }
}
