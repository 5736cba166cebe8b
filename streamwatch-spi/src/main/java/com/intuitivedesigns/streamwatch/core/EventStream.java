/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.core;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Consumer side of a source: a bounded, single-consumer queue of elements that ends either in
 * normal completion (the source was cancelled) or in a failure.
 *
 * <p>Elements buffered before a failure are still handed out; the failure surfaces once the
 * buffer is drained.</p>
 *
 * @param <E> element type
 */
public interface EventStream<E> extends AutoCloseable {

    /**
     * Waits up to {@code timeout} for the next element.
     *
     * @return the element, or empty on timeout or after completion
     * @throws SourceFailedException once the source has failed and the buffer is drained
     */
    Optional<E> poll(Duration timeout) throws InterruptedException;

    /**
     * Blocks until an element is available.
     *
     * @return the element, or empty once the stream completed normally
     * @throws SourceFailedException once the source has failed and the buffer is drained
     */
    Optional<E> take() throws InterruptedException;

    /**
     * Hands every element to {@code action} until the stream terminates.
     *
     * @throws SourceFailedException if the stream ends in failure
     */
    default void forEach(Consumer<? super E> action) throws InterruptedException {
        while (true) {
            Optional<E> next = take();
            if (next.isEmpty()) return;
            action.accept(next.get());
        }
    }

    /** True once the source has completed or failed (buffered elements may remain). */
    boolean isTerminated();

    /** True once the source completed without error. */
    boolean isCompleted();

    /** The terminal error, if the source failed. */
    Optional<Throwable> failure();

    int size();

    int capacity();

    /**
     * Downstream is done. Cancels the source that feeds this stream.
     */
    @Override
    void close();
}
