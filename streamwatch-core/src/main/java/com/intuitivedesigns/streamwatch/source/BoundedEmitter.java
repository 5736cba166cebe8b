/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.source;

import com.intuitivedesigns.streamwatch.core.EventStream;
import com.intuitivedesigns.streamwatch.core.OverflowPolicy;
import com.intuitivedesigns.streamwatch.core.SourceFailedException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity hand-off between one producing source and one consumer.
 *
 * <p><b>Producer side</b> ({@link #offer}, {@link #awaitSpace}, {@link #complete},
 * {@link #fail}) is called from the source's scheduler thread. <b>Consumer side</b> is the
 * {@link EventStream} contract. A single lock guards both; neither side ever waits on the
 * other while holding it beyond a condition await.</p>
 *
 * <p>Never blocks the producer: when full, {@link #offer} applies the {@link OverflowPolicy}
 * immediately.</p>
 *
 * @param <E> element type
 */
public final class BoundedEmitter<E> implements EventStream<E> {

    /** Result of a producer {@link #offer}. */
    public enum OfferResult {
        ENQUEUED,
        DROPPED_OLDEST,
        DROPPED_NEWEST,
        /** Full under {@link OverflowPolicy#FAIL}; nothing was enqueued. */
        OVERFLOW,
        /** Already completed or failed. */
        REJECTED
    }

    private final String sourceName;
    private final int capacity;
    private final OverflowPolicy policy;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final ArrayDeque<E> buffer;

    // Guarded by lock
    private boolean completed;
    private Throwable failure;
    private Runnable spaceCallback;

    private volatile Runnable onClose;

    public BoundedEmitter(String sourceName, int capacity, OverflowPolicy policy) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Buffer capacity must be > 0, got " + capacity);
        }
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.capacity = capacity;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.buffer = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    // --- Producer ---

    public OfferResult offer(E element) {
        Objects.requireNonNull(element, "element");
        lock.lock();
        try {
            if (isTerminatedLocked()) return OfferResult.REJECTED;

            if (buffer.size() < capacity) {
                buffer.addLast(element);
                notEmpty.signal();
                return OfferResult.ENQUEUED;
            }

            switch (policy) {
                case DROP_OLDEST:
                    buffer.pollFirst();
                    buffer.addLast(element);
                    notEmpty.signal();
                    return OfferResult.DROPPED_OLDEST;
                case DROP_NEWEST:
                    return OfferResult.DROPPED_NEWEST;
                case FAIL:
                default:
                    return OfferResult.OVERFLOW;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * If the buffer is full, registers {@code callback} to run once the consumer frees a slot and
     * returns {@code true}. Returns {@code false} (and registers nothing) when there is room.
     * The callback runs on the consumer's thread.
     */
    public boolean awaitSpace(Runnable callback) {
        lock.lock();
        try {
            if (buffer.size() < capacity || isTerminatedLocked()) return false;
            spaceCallback = callback;
            return true;
        } finally {
            lock.unlock();
        }
    }


    /**
     * Ends the stream normally. The first terminal signal wins.
     */
    public void complete() {
        lock.lock();
        try {
            if (isTerminatedLocked()) return;
            completed = true;
            spaceCallback = null;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends the stream with {@code cause}. The first terminal signal wins.
     */
    public void fail(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        lock.lock();
        try {
            if (isTerminatedLocked()) return;
            failure = cause;
            spaceCallback = null;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void onClose(Runnable hook) {
        this.onClose = hook;
    }

    // --- Consumer ---

    @Override
    public Optional<E> poll(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        long remaining = timeout.toNanos();
        Runnable callback;
        E element;

        lock.lock();
        try {
            while (buffer.isEmpty()) {
                if (isTerminatedLocked()) return terminalLocked();
                if (remaining <= 0L) return Optional.empty();
                remaining = notEmpty.awaitNanos(remaining);
            }
            element = buffer.pollFirst();
            callback = takeSpaceCallbackLocked();
        } finally {
            lock.unlock();
        }

        if (callback != null) callback.run();
        return Optional.of(element);
    }

    @Override
    public Optional<E> take() throws InterruptedException {
        Runnable callback;
        E element;

        lock.lock();
        try {
            while (buffer.isEmpty()) {
                if (isTerminatedLocked()) return terminalLocked();
                notEmpty.await();
            }
            element = buffer.pollFirst();
            callback = takeSpaceCallbackLocked();
        } finally {
            lock.unlock();
        }

        if (callback != null) callback.run();
        return Optional.of(element);
    }

    /**
     * Waits until the source has completed or failed.
     *
     * @return false on timeout
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (!isTerminatedLocked()) {
                if (remaining <= 0L) return false;
                remaining = notEmpty.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isTerminated() {
        lock.lock();
        try {
            return isTerminatedLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isCompleted() {
        lock.lock();
        try {
            return completed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Throwable> failure() {
        lock.lock();
        try {
            return Optional.ofNullable(failure);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    public OverflowPolicy policy() {
        return policy;
    }

    @Override
    public void close() {
        Runnable hook = onClose;
        if (hook != null) {
            hook.run();
        } else {
            complete();
        }
    }

    // --- Internals ---

    private boolean isTerminatedLocked() {
        return completed || failure != null;
    }

    private Optional<E> terminalLocked() {
        if (failure != null) {
            throw new SourceFailedException(sourceName, failure);
        }
        return Optional.empty();
    }

    private Runnable takeSpaceCallbackLocked() {
        Runnable cb = spaceCallback;
        spaceCallback = null;
        return cb;
    }
}
