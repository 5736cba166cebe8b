/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.core;

import java.util.Objects;

/**
 * Outcome of one receive or decode step.
 *
 * <p>Three cases, never {@code null}:</p>
 * <ul>
 * <li>{@link Kind#EVENT}: a value is available.</li>
 * <li>{@link Kind#EMPTY}: nothing right now (idle poll, end of batch). Not a failure.</li>
 * <li>{@link Kind#ERROR}: the step failed with {@link #error()}.</li>
 * </ul>
 *
 * @param <T> value type
 */
public final class ReceiveResult<T> {

    public enum Kind { EVENT, EMPTY, ERROR }

    private static final ReceiveResult<?> EMPTY = new ReceiveResult<>(Kind.EMPTY, null, null);

    private final Kind kind;
    private final T value;
    private final Throwable error;

    private ReceiveResult(Kind kind, T value, Throwable error) {
        this.kind = kind;
        this.value = value;
        this.error = error;
    }

    public static <T> ReceiveResult<T> event(T value) {
        return new ReceiveResult<>(Kind.EVENT, Objects.requireNonNull(value, "value"), null);
    }

    @SuppressWarnings("unchecked")
    public static <T> ReceiveResult<T> empty() {
        return (ReceiveResult<T>) EMPTY;
    }

    public static <T> ReceiveResult<T> error(Throwable error) {
        return new ReceiveResult<>(Kind.ERROR, null, Objects.requireNonNull(error, "error"));
    }

    public Kind kind() {
        return kind;
    }

    public boolean isEvent() {
        return kind == Kind.EVENT;
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    /**
     * @throws IllegalStateException if this is not an {@link Kind#EVENT}
     */
    public T value() {
        if (kind != Kind.EVENT) {
            throw new IllegalStateException("No value on a " + kind + " result");
        }
        return value;
    }

    /**
     * @throws IllegalStateException if this is not an {@link Kind#ERROR}
     */
    public Throwable error() {
        if (kind != Kind.ERROR) {
            throw new IllegalStateException("No error on a " + kind + " result");
        }
        return error;
    }

    @Override
    public String toString() {
        switch (kind) {
            case EVENT:
                return "ReceiveResult[EVENT " + value + "]";
            case ERROR:
                return "ReceiveResult[ERROR " + error + "]";
            default:
                return "ReceiveResult[EMPTY]";
        }
    }
}
