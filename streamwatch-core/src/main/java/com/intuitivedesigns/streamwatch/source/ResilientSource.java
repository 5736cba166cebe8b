/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.source;

import com.intuitivedesigns.streamwatch.config.SourceSettings;
import com.intuitivedesigns.streamwatch.core.ConnectionFactory;
import com.intuitivedesigns.streamwatch.core.ConnectionHandle;
import com.intuitivedesigns.streamwatch.core.ConnectionListener;
import com.intuitivedesigns.streamwatch.core.DeliveryMode;
import com.intuitivedesigns.streamwatch.core.EventDecodeException;
import com.intuitivedesigns.streamwatch.core.EventDecoder;
import com.intuitivedesigns.streamwatch.core.EventSource;
import com.intuitivedesigns.streamwatch.core.EventStream;
import com.intuitivedesigns.streamwatch.core.FailureClassification;
import com.intuitivedesigns.streamwatch.core.FailureClassifier;
import com.intuitivedesigns.streamwatch.core.OverflowPolicy;
import com.intuitivedesigns.streamwatch.core.ReceiveResult;
import com.intuitivedesigns.streamwatch.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Production-Grade Resilient Source.
 *
 * Keeps exactly one connection to an external resource alive and republishes what it delivers
 * through a {@link BoundedEmitter}.
 *
 * Features:
 * - Single scheduler thread per source: pulls, push callbacks, watchdog ticks, reconnects and
 *   cancellation never run concurrently, so no state below needs a lock
 * - Stale callbacks ignored: every connection carries a generation number
 * - Retriable failures reconnect with backoff; fatal ones, decode errors and an exhausted
 *   budget terminate the stream
 * - Watchdog replaces silently dead connections without touching the backoff budget
 * - Cancellation completes the stream without error, even when a failure races it
 *
 * @param <R> raw transport message
 * @param <E> emitted element
 */
public final class ResilientSource<R, E> implements EventSource<E> {

    private static final Logger log = LoggerFactory.getLogger(ResilientSource.class);

    private final String name;
    private final ConnectionFactory<R> factory;
    private final EventDecoder<R, E> decoder;
    private final FailureClassifier classifier;
    private final BackoffState backoff;
    private final Duration idleInterval;
    private final SourceListener listener;
    private final BoundedEmitter<E> emitter;
    private final ScheduledThreadPoolExecutor scheduler;
    private final Watchdog watchdog;
    private final List<AutoCloseable> resources;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile boolean cancelRequested;
    private volatile SourceState state = SourceState.IDLE;

    // --- Scheduler-confined state ---
    private ConnectionHandle<R> current;
    private long generation;
    private ScheduledFuture<?> reconnectTask;
    private ScheduledFuture<?> pullTask;

    private ResilientSource(Builder<R, E> b) {
        this.name = b.name;
        this.factory = b.factory;
        this.decoder = b.decoder;
        this.classifier = b.classifier;
        this.backoff = new BackoffState(b.backoff, b.maxAttempts, b.maxRetryDuration);
        this.idleInterval = b.idleInterval;
        this.listener = buildListener(b);
        this.resources = List.copyOf(b.resources);
        this.emitter = new BoundedEmitter<>(b.name, b.capacity, b.overflowPolicy);
        this.emitter.onClose(this::cancel);

        this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "sw-source-" + b.name);
            t.setDaemon(true);
            return t;
        });
        this.scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.scheduler.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        this.scheduler.setRemoveOnCancelPolicy(true);

        this.watchdog = new Watchdog(scheduler, b.watchdogInterval, this::checkLiveness);
    }

    private static SourceListener buildListener(Builder<?, ?> b) {
        List<SourceListener> all = new ArrayList<>();
        all.add(new LoggingSourceListener());
        if (b.metrics != null && b.metrics != MetricsRuntime.NOOP) {
            all.add(new MetricsSourceListener(b.metrics));
        }
        all.addAll(b.listeners);
        return SourceListener.composite(all);
    }

    public static <R, E> Builder<R, E> builder() {
        return new Builder<>();
    }

    // --- EventSource ---

    @Override
    public String name() {
        return name;
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Source '" + name + "' already started");
        }
        execute(this::doStart);
    }

    @Override
    public void cancel() {
        cancelRequested = true;
        execute(this::doCancel);
    }

    @Override
    public EventStream<E> events() {
        return emitter;
    }

    public SourceState state() {
        return state;
    }

    /**
     * Waits until the source reaches {@link SourceState#FAILED} or {@link SourceState#COMPLETED}.
     *
     * @return false on timeout
     */
    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    // --- Lifecycle (scheduler thread) ---

    private void doStart() {
        if (cancelRequested || state.isTerminal()) return;
        listener.onStarted(name);
        try {
            openConnection();
        } catch (Exception e) {
            fatal(new ConnectionConstructionException(name, e));
            return;
        }
        state = SourceState.CONNECTED;
        watchdog.arm();
        schedulePull(generation, Duration.ZERO);
    }

    /**
     * Asks the factory for a new handle. The previous one must already be disposed.
     */
    private void openConnection() throws Exception {
        if (current != null) {
            throw new IllegalStateException("Previous connection of '" + name + "' not disposed");
        }
        final long gen = ++generation;
        ConnectionHandle<R> handle = factory.open(new GenerationListener(gen));
        if (handle == null) {
            throw new IllegalStateException("Connection factory returned null for '" + name + "'");
        }
        current = handle;
        watchdog.markAlive();
        listener.onConnected(name, gen);
    }

    private void doCancel() {
        if (state.isTerminal()) return;
        stopTimers();
        disposeCurrent(true);
        state = SourceState.COMPLETED;
        listener.onCompleted(name);
        emitter.complete();
        shutdown();
    }

    private void fatal(Throwable cause) {
        if (state.isTerminal()) return;
        stopTimers();
        disposeCurrent(false);
        state = SourceState.FAILED;
        listener.onFailed(name, cause);
        emitter.fail(cause);
        shutdown();
    }

    private void shutdown() {
        releaseResources();
        scheduler.shutdown();
        terminated.countDown();
    }

    /**
     * Closes the shared clients handed to {@link Builder#closeOnTermination}, last registered first.
     */
    private void releaseResources() {
        for (int i = resources.size() - 1; i >= 0; i--) {
            try {
                resources.get(i).close();
            } catch (Exception e) {
                log.warn("Error releasing resource of '{}'", name, e);
            }
        }
    }

    private void stopTimers() {
        watchdog.cancel();
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
        cancelPull();
    }

    private void cancelPull() {
        if (pullTask != null) {
            pullTask.cancel(false);
            pullTask = null;
        }
    }

    /**
     * Disposes the current handle exactly once; {@code terminal} only on cancellation.
     */
    private void disposeCurrent(boolean terminal) {
        ConnectionHandle<R> h = current;
        current = null;
        cancelPull();
        if (h == null) return;
        try {
            if (terminal) {
                h.terminate();
            } else {
                h.close();
            }
        } catch (RuntimeException e) {
            log.warn("Error closing connection of '{}'", name, e);
        }
    }

    // --- Delivery ---

    private void schedulePull(long gen, Duration delay) {
        if (current == null || current.mode() != DeliveryMode.PULL) return;
        cancelPull();
        pullTask = scheduler.schedule(guarded(() -> pullNext(gen)), delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void pullNext(long gen) {
        pullTask = null;
        if (state != SourceState.CONNECTED || gen != generation || current == null) return;

        // Resume once the consumer frees a slot
        if (emitter.awaitSpace(() -> execute(() -> pullNext(gen)))) return;

        ReceiveResult<R> result;
        try {
            result = current.receive();
        } catch (Exception e) {
            onConnectionFailure(e);
            return;
        }
        if (result == null) result = ReceiveResult.empty();

        switch (result.kind()) {
            case EVENT:
                if (deliver(result.value())) schedulePull(gen, Duration.ZERO);
                break;
            case ERROR:
                onConnectionFailure(result.error());
                break;
            case EMPTY:
            default:
                schedulePull(gen, idleInterval);
                break;
        }
    }

    /**
     * Decodes and emits one raw message.
     *
     * @return false if the source terminated
     */
    private boolean deliver(R raw) {
        watchdog.markAlive();
        ReceiveResult<E> decoded;
        try {
            decoded = decoder.decode(raw);
        } catch (Exception e) {
            fatal(e instanceof EventDecodeException ? e
                    : new EventDecodeException("Failed to decode message from '" + name + "'", e));
            return false;
        }
        if (decoded == null || decoded.isEmpty()) return true;
        if (decoded.isError()) {
            Throwable err = decoded.error();
            fatal(err instanceof EventDecodeException ? err
                    : new EventDecodeException("Failed to decode message from '" + name + "'", err));
            return false;
        }

        backoff.reset();
        return emit(decoded.value());
    }

    private boolean emit(E element) {
        BoundedEmitter.OfferResult r = emitter.offer(element);
        switch (r) {
            case ENQUEUED:
                listener.onEvent(name);
                return true;
            case DROPPED_OLDEST:
            case DROPPED_NEWEST:
                listener.onDropped(name, emitter.policy());
                return true;
            case OVERFLOW:
                fatal(new EmitterOverflowException(name, emitter.capacity()));
                return false;
            case REJECTED:
            default:
                return false;
        }
    }

    // --- Failure handling ---

    private void onConnectionFailure(Throwable error) {
        if (state.isTerminal()) return;
        if (cancelRequested) {
            log.debug("Ignoring error on '{}' after cancellation: {}", name, error.toString());
            doCancel();
            return;
        }
        if (classify(error) == FailureClassification.FATAL) {
            fatal(error);
        } else {
            scheduleReconnect(error);
        }
    }

    private FailureClassification classify(Throwable error) {
        if (error instanceof EventDecodeException) return FailureClassification.FATAL;
        try {
            FailureClassification c = classifier.classify(error);
            return c == null ? FailureClassification.FATAL : c;
        } catch (RuntimeException e) {
            log.warn("Failure classifier of '{}' threw; treating error as fatal", name, e);
            return FailureClassification.FATAL;
        }
    }

    private void scheduleReconnect(Throwable cause) {
        disposeCurrent(false);
        Duration delay = backoff.advance();
        if (backoff.isExhausted()) {
            fatal(new RetryBudgetExhaustedException(name, backoff.attempts(), cause));
            return;
        }
        state = SourceState.RECONNECTING;
        listener.onReconnectScheduled(name, backoff.attempts(), delay, cause);
        reconnectTask = scheduler.schedule(guarded(this::reconnect), delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void reconnect() {
        reconnectTask = null;
        if (cancelRequested || state.isTerminal()) return;
        try {
            openConnection();
        } catch (Exception e) {
            if (cancelRequested) {
                doCancel();
                return;
            }
            scheduleReconnect(e);
            return;
        }
        state = SourceState.CONNECTED;
        schedulePull(generation, Duration.ZERO);
    }

    /**
     * Replaces the current connection immediately, bypassing backoff.
     */
    private void recreate(String reason) {
        if (state != SourceState.CONNECTED) return;
        listener.onStallDetected(name, reason);
        disposeCurrent(false);
        try {
            openConnection();
        } catch (Exception e) {
            if (cancelRequested) {
                doCancel();
                return;
            }
            scheduleReconnect(e);
            return;
        }
        schedulePull(generation, Duration.ZERO);
    }

    private void checkLiveness() {
        if (state != SourceState.CONNECTED || current == null) return;
        if (current.isActive()) {
            watchdog.markAlive();
        } else {
            recreate("watchdog found connection inactive, last seen alive "
                    + watchdog.silence().toMillis() + "ms ago");
        }
    }

    // --- Scheduling ---

    private void execute(Runnable task) {
        try {
            scheduler.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("Source '{}' already terminated; task dropped", name);
        }
    }

    /**
     * Anything escaping a task (a handle, a decoder, a linkage error in a codec) fails the
     * source; otherwise the consumer would wait on a stream nobody terminates.
     */
    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Throwable t) {
                fatal(t);
            }
        };
    }

    /**
     * Marshals push callbacks onto the scheduler and drops those from a replaced connection.
     */
    private final class GenerationListener implements ConnectionListener<R> {
        private final long gen;

        GenerationListener(long gen) {
            this.gen = gen;
        }

        private boolean stale() {
            return gen != generation || current == null || state.isTerminal();
        }

        @Override
        public void onMessage(R raw) {
            execute(() -> {
                if (!stale()) deliver(raw);
            });
        }

        @Override
        public void onError(Throwable error) {
            Objects.requireNonNull(error, "error");
            execute(() -> {
                if (!stale()) onConnectionFailure(error);
            });
        }

        @Override
        public void onClose() {
            execute(() -> {
                if (!stale()) recreate("connection closed by remote");
            });
        }
    }

    // --- Builder ---

    public static final class Builder<R, E> {
        private String name;
        private ConnectionFactory<R> factory;
        private EventDecoder<R, E> decoder;
        private FailureClassifier classifier = FailureClassifier.alwaysFatal();
        private BackoffPolicy backoff = BackoffPolicy.exponential(Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0);
        private int maxAttempts;
        private Duration maxRetryDuration = Duration.ZERO;
        private Duration watchdogInterval = Duration.ZERO;
        private Duration idleInterval = Duration.ofSeconds(1);
        private int capacity = 256;
        private OverflowPolicy overflowPolicy = OverflowPolicy.FAIL;
        private final List<SourceListener> listeners = new ArrayList<>();
        private final List<AutoCloseable> resources = new ArrayList<>();
        private MetricsRuntime metrics = MetricsRuntime.NOOP;

        private Builder() {}

        public Builder<R, E> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<R, E> connectionFactory(ConnectionFactory<R> factory) {
            this.factory = factory;
            return this;
        }

        public Builder<R, E> decoder(EventDecoder<R, E> decoder) {
            this.decoder = decoder;
            return this;
        }

        public Builder<R, E> classifier(FailureClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder<R, E> backoff(BackoffPolicy backoff) {
            this.backoff = backoff;
            return this;
        }

        /** Consecutive retriable failures tolerated; 0 means unbounded. */
        public Builder<R, E> maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /** Length of a failure streak tolerated; zero means unbounded. */
        public Builder<R, E> maxRetryDuration(Duration maxRetryDuration) {
            this.maxRetryDuration = maxRetryDuration;
            return this;
        }

        /** Zero disables the watchdog. */
        public Builder<R, E> watchdogInterval(Duration watchdogInterval) {
            this.watchdogInterval = watchdogInterval;
            return this;
        }

        /** Delay before re-polling a pull-style handle after an empty receive. */
        public Builder<R, E> idleInterval(Duration idleInterval) {
            this.idleInterval = idleInterval;
            return this;
        }

        public Builder<R, E> capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder<R, E> overflowPolicy(OverflowPolicy overflowPolicy) {
            this.overflowPolicy = overflowPolicy;
            return this;
        }

        public Builder<R, E> listener(SourceListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /**
         * Registers a client shared by every connection the factory opens (a pool, a session).
         * It is closed once, after the last connection, when the source completes or fails.
         */
        public Builder<R, E> closeOnTermination(AutoCloseable resource) {
            this.resources.add(Objects.requireNonNull(resource, "resource"));
            return this;
        }

        public Builder<R, E> metrics(MetricsRuntime metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Applies the common knobs bound from configuration.
         */
        public Builder<R, E> settings(SourceSettings s) {
            return capacity(s.capacity())
                    .overflowPolicy(s.overflowPolicy())
                    .backoff(s.backoffPolicy())
                    .maxAttempts(s.maxAttempts())
                    .maxRetryDuration(s.maxRetryDuration())
                    .watchdogInterval(s.watchdogInterval())
                    .idleInterval(s.idleInterval());
        }

        public ResilientSource<R, E> build() {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
            Objects.requireNonNull(factory, "connectionFactory");
            Objects.requireNonNull(decoder, "decoder");
            Objects.requireNonNull(classifier, "classifier");
            Objects.requireNonNull(backoff, "backoff");
            Objects.requireNonNull(overflowPolicy, "overflowPolicy");
            Objects.requireNonNull(idleInterval, "idleInterval");
            if (idleInterval.isNegative()) throw new IllegalArgumentException("idleInterval must be >= 0");
            if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
            if (maxRetryDuration == null) maxRetryDuration = Duration.ZERO;
            return new ResilientSource<>(this);
        }
    }
}
