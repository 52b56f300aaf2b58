/*
 *  Licensed to the Apache Software Foundation (ASF) under one
 *  or more contributor license agreements.  See the NOTICE file
 *  distributed with this work for additional information
 *  regarding copyright ownership.  The ASF licenses this file
 *  to you under the Apache License, Version 2.0 (the
 *  "License"); you may not use this file except in compliance
 *  with the License.  You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing,
 *  software distributed under the License is distributed on an
 *  "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 *  KIND, either express or implied.  See the License for the
 *  specific language governing permissions and limitations
 *  under the License.
 */

package org.apache.resilience.api;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.resilience.exception.DeadlineExceededException;

/**
 * Cancellation signal carried by a call through the resilience primitives.
 *
 * <p>A context becomes <em>done</em> when it is cancelled explicitly, when its deadline
 * passes, or when its parent becomes done. Once done, {@link #cause()} returns the
 * error describing why: a plain {@link CancellationException} for an explicit cancel,
 * a {@link DeadlineExceededException} for an expired deadline. This error is what the
 * primitives surface when a caller gives up, so that it can be told apart from a
 * rejection by an unhealthy dependency.</p>
 *
 * <p>Contexts form a tree: children created through {@link #withCancel()} or
 * {@link #withTimeout(Duration)} are done no later than their parent. A child that is
 * neither cancelled nor bounded by a deadline stays attached to its parent until the
 * parent is done.</p>
 */
public final class CallContext {
    private static final Registration NO_REGISTRATION = () -> {
    };
    private static final CallContext BACKGROUND = new CallContext(null, false, 0L);

    private final CompletableFuture<Void> done = new CompletableFuture<>();
    private final Set<Runnable> listeners = ConcurrentHashMap.newKeySet();
    private final AtomicReference<CancellationException> cause = new AtomicReference<>();
    private final CallContext parent;
    private final boolean hasDeadline;
    private final long deadline;
    private volatile Registration parentRegistration = NO_REGISTRATION;

    private CallContext(final CallContext parent, final boolean hasDeadline, final long deadline) {
        this.parent = parent;
        this.hasDeadline = hasDeadline;
        this.deadline = deadline;
    }

    /**
     * @return the root context, which is never done and cannot be cancelled.
     */
    public static CallContext background() {
        return BACKGROUND;
    }

    public static CallContext timeout(final Duration timeout) {
        return BACKGROUND.withTimeout(timeout);
    }

    public static CallContext cancellable() {
        return BACKGROUND.withCancel();
    }

    public CallContext withCancel() {
        final CallContext child = new CallContext(this, hasDeadline, deadline);
        propagateTo(child);
        return child;
    }

    public CallContext withTimeout(final Duration timeout) {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout can't be negative: " + timeout);
        }
        final long requested = System.nanoTime() + timeout.toNanos();
        final long effective = hasDeadline && deadline - requested < 0 ? deadline : requested;
        final CallContext child = new CallContext(this, true, effective);
        propagateTo(child);
        if (!child.isDone()) {
            final ScheduledFuture<?> timer = Scheduler.INSTANCE.schedule(
                    () -> child.complete(new DeadlineExceededException("deadline exceeded after " + timeout)),
                    Math.max(0, effective - System.nanoTime()), NANOSECONDS);
            child.onDone(() -> timer.cancel(false));
        }
        return child;
    }

    /**
     * Cancels this context and all of its children.
     *
     * @throws UnsupportedOperationException on the background context.
     */
    public void cancel() {
        if (this == BACKGROUND) {
            throw new UnsupportedOperationException("the background context can't be cancelled");
        }
        complete(new CancellationException("call context cancelled"));
    }

    public boolean isDone() {
        return done.isDone();
    }

    /**
     * @return why this context is done, or {@code null} while it is still live.
     */
    public CancellationException cause() {
        return cause.get();
    }

    /**
     * Runs {@code listener} once this context is done, immediately when it already is.
     * Closing the returned registration detaches a listener that did not run yet; callers
     * waiting on a long-lived context must close it once they stop waiting.
     *
     * @return the registration, a no-op for the background context which is never done.
     */
    public Registration onDone(final Runnable listener) {
        if (this == BACKGROUND) {
            return NO_REGISTRATION;
        }
        final Runnable entry = listener::run;
        listeners.add(entry);
        if (isDone() && listeners.remove(entry)) {
            entry.run();
        }
        return () -> listeners.remove(entry);
    }

    /**
     * @return a future completing (normally) once this context is done. Cancelling the
     * returned future detaches it from this context.
     */
    public CompletableFuture<Void> whenDone() {
        final CompletableFuture<Void> future = new CompletableFuture<>();
        final Registration registration = onDone(() -> future.complete(null));
        future.whenComplete((r, e) -> registration.close());
        return future;
    }

    /**
     * @return how many listeners wait on this context, for monitoring.
     */
    public int getPendingListenerCount() {
        return listeners.size();
    }

    public void throwIfDone() {
        final CancellationException error = cause.get();
        if (error != null) {
            throw error;
        }
    }

    /**
     * Waits for {@code delay} unless the context becomes done first, in which case the
     * context's error is thrown immediately.
     */
    public void sleep(final Duration delay) throws InterruptedException {
        throwIfDone();
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            done.get(delay.toNanos(), NANOSECONDS);
        } catch (final TimeoutException elapsed) {
            return;
        } catch (final ExecutionException e) {
            throw new IllegalStateException(e.getCause());
        }
        throw cause.get();
    }

    public Optional<Duration> remaining() {
        if (!hasDeadline) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
    }

    public CallContext getParent() {
        return parent;
    }

    private void propagateTo(final CallContext child) {
        if (this == BACKGROUND) {
            return;
        }
        child.parentRegistration = onDone(() -> child.complete(cause.get()));
    }

    private void complete(final CancellationException error) {
        if (cause.compareAndSet(null, error)) {
            parentRegistration.close();
            done.complete(null);
            for (final Runnable listener : listeners) {
                if (listeners.remove(listener)) {
                    listener.run();
                }
            }
        }
    }

    @Override
    public String toString() {
        if (this == BACKGROUND) {
            return "CallContext{background}";
        }
        return "CallContext{done=" + isDone()
                + (hasDeadline ? ", remaining=" + remaining().orElse(Duration.ZERO) : "") + '}';
    }

    /**
     * Handle detaching a listener registered through {@link #onDone(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private static final class Scheduler {
        private static final ScheduledExecutorService INSTANCE = create();

        private static ScheduledExecutorService create() {
            final ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
                final Thread thread = new Thread(r, "org.apache.resilience.context-deadline");
                thread.setDaemon(true);
                return thread;
            });
            executor.setRemoveOnCancelPolicy(true);
            return executor;
        }
    }
}
