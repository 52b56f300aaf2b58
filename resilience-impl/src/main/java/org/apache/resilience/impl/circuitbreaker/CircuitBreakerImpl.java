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

package org.apache.resilience.impl.circuitbreaker;

import static org.apache.resilience.api.circuitbreaker.CircuitBreakerState.CLOSED;
import static org.apache.resilience.api.circuitbreaker.CircuitBreakerState.HALF_OPEN;
import static org.apache.resilience.api.circuitbreaker.CircuitBreakerState.OPEN;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

import org.apache.resilience.api.CallContext;
import org.apache.resilience.api.ContextualCallable;
import org.apache.resilience.api.circuitbreaker.CircuitBreaker;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerDefinition;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerState;
import org.apache.resilience.api.circuitbreaker.Counts;
import org.apache.resilience.exception.CircuitOpenException;
import org.apache.resilience.exception.CircuitTimeoutException;
import org.apache.resilience.exception.DeadlineExceededException;
import org.apache.resilience.exception.TooManyRequestsException;
import org.apache.resilience.impl.metrics.InMemoryResilienceMetrics;
import org.apache.resilience.impl.metrics.ResilienceMetrics;
import org.apache.resilience.impl.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generation based circuit breaker. Every state change and every closed window rollover
 * starts a new generation with empty counts; a call completing after the generation it
 * started in has ended is ignored.
 */
public class CircuitBreakerImpl implements CircuitBreaker {
    private static final Logger LOGGER = LoggerFactory.getLogger(CircuitBreakerImpl.class);

    static final ExecutorService DEFAULT_EXECUTOR =
            Executors.newCachedThreadPool(new NamedThreadFactory("resilience-circuit-breaker-"));

    private final CircuitBreakerDefinition definition;
    private final String name;
    private final int maxRequests;
    private final long interval;
    private final long timeout;
    private final ExecutorService executor;
    private final LongSupplier clock;
    private final Lock lock = new ReentrantLock();

    private final ResilienceMetrics.Counter callsSucceeded;
    private final ResilienceMetrics.Counter callsFailed;
    private final ResilienceMetrics.Counter callsPrevented;
    private final ResilienceMetrics.Counter opened;

    // guarded by lock
    private CircuitBreakerState state = CLOSED;
    private long generation;
    private boolean expiring;
    private long expiry;
    private int requests;
    private int totalSuccesses;
    private int totalFailures;
    private int consecutiveSuccesses;
    private int consecutiveFailures;

    public CircuitBreakerImpl(final CircuitBreakerDefinition definition) {
        this(definition, new InMemoryResilienceMetrics());
    }

    /**
     * Calls made through {@link #executeWithContext(CallContext, ContextualCallable)} run on a
     * shared pool of daemon threads.
     */
    public CircuitBreakerImpl(final CircuitBreakerDefinition definition, final ResilienceMetrics metrics) {
        this(definition, metrics, DEFAULT_EXECUTOR);
    }

    public CircuitBreakerImpl(final CircuitBreakerDefinition definition, final ResilienceMetrics metrics,
                              final ExecutorService executor) {
        this(definition, metrics, executor, System::nanoTime);
    }

    CircuitBreakerImpl(final CircuitBreakerDefinition definition, final ResilienceMetrics metrics,
                       final ExecutorService executor, final LongSupplier clock) {
        this.definition = definition;
        this.name = definition.getName();
        this.maxRequests = definition.getMaxRequests();
        this.interval = definition.getInterval().toNanos();
        this.timeout = definition.getTimeout().toNanos();
        this.executor = executor;
        this.clock = clock;

        final String metricsNameBase = "resilience.circuitbreaker." + name + ".";
        this.callsSucceeded = metrics.counter(metricsNameBase + "callsSucceeded.total",
                "Number of calls allowed to run by the circuit breaker that returned successfully");
        this.callsFailed = metrics.counter(metricsNameBase + "callsFailed.total",
                "Number of calls allowed to run by the circuit breaker that then failed");
        this.callsPrevented = metrics.counter(metricsNameBase + "callsPrevented.total",
                "Number of calls prevented from running by an open or saturated half-open circuit breaker");
        this.opened = metrics.counter(metricsNameBase + "opened.total",
                "Number of times the circuit breaker has moved to open state");
        metrics.gauge(metricsNameBase + "generation", "Current measurement generation", "none", this::getGeneration);

        toNewGeneration(clock.getAsLong());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CircuitBreakerDefinition getDefinition() {
        return definition;
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return currentState(clock.getAsLong());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Counts getCounts() {
        lock.lock();
        try {
            return counts();
        } finally {
            lock.unlock();
        }
    }

    public long getCallsSucceeded() {
        return callsSucceeded.getCount();
    }

    public long getCallsFailed() {
        return callsFailed.getCount();
    }

    public long getCallsPrevented() {
        return callsPrevented.getCount();
    }

    public long getTimesOpened() {
        return opened.getCount();
    }

    @Override
    public <T> T execute(final Callable<T> callable) throws Exception {
        final long before = beforeRequest();
        final T result;
        try {
            result = callable.call();
        } catch (final Exception e) {
            afterRequest(before, isSuccessful(e));
            throw e;
        } catch (final Error e) {
            afterRequest(before, false);
            throw e;
        }
        afterRequest(before, isSuccessful(null));
        return result;
    }

    @Override
    public <T> T executeWithContext(final CallContext context, final ContextualCallable<T> callable) throws Exception {
        final long before = beforeRequest();
        final CompletableFuture<Outcome<T>> task = new CompletableFuture<>();
        final Future<?> worker;
        try {
            worker = executor.submit(() -> {
                try {
                    task.complete(Outcome.success(callable.call(context)));
                } catch (final Throwable t) {
                    task.complete(Outcome.failure(t));
                }
            });
        } catch (final RejectedExecutionException e) {
            afterRequest(before, false);
            throw e;
        }

        // a null outcome means the context was done first
        try (CallContext.Registration ignored = context.onDone(() -> task.complete(null))) {
            task.get();
        } catch (final InterruptedException e) {
            worker.cancel(true);
            afterRequest(before, false);
            Thread.currentThread().interrupt();
            throw e;
        } catch (final ExecutionException e) {
            // task never completes exceptionally
            throw new IllegalStateException(e.getCause());
        }

        final Outcome<T> outcome = task.getNow(null);
        if (outcome == null) {
            worker.cancel(true);
            afterRequest(before, false);
            LOGGER.debug("Circuit breaker '{}' gave up on a call: {}", name, context.cause().getMessage());
            throw context.cause();
        }
        if (outcome.error == null) {
            afterRequest(before, isSuccessful(null));
            return outcome.value;
        }
        if (outcome.error instanceof Exception) {
            afterRequest(before, isSuccessful(outcome.error));
            throw (Exception) outcome.error;
        }
        afterRequest(before, false);
        if (outcome.error instanceof Error) {
            throw (Error) outcome.error;
        }
        throw new IllegalStateException(outcome.error);
    }

    @Override
    public <T> T executeWithTimeout(final Duration timeout, final ContextualCallable<T> callable) throws Exception {
        final CallContext context = CallContext.timeout(timeout);
        try {
            return executeWithContext(context, callable);
        } catch (final DeadlineExceededException e) {
            if (e == context.cause()) {
                throw new CircuitTimeoutException("circuit breaker '" + name + "' timed out after " + timeout, e);
            }
            throw e;
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            final CircuitBreakerState previous = state;
            state = CLOSED;
            toNewGeneration(clock.getAsLong());
            if (previous != CLOSED) {
                onStateChange(previous, CLOSED);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void transitionState(final CircuitBreakerState target) {
        lock.lock();
        try {
            setState(target, clock.getAsLong());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counts one failed call without running anything. Rejected like any other call when the
     * breaker does not admit calls.
     */
    void recordFailure() {
        afterRequest(beforeRequest(), false);
    }

    private long beforeRequest() {
        lock.lock();
        try {
            final CircuitBreakerState current = currentState(clock.getAsLong());
            if (current == OPEN) {
                callsPrevented.inc();
                LOGGER.debug("Circuit breaker '{}' is open, rejecting call", name);
                throw new CircuitOpenException(name);
            }
            if (current == HALF_OPEN && requests >= maxRequests) {
                callsPrevented.inc();
                LOGGER.debug("Circuit breaker '{}' is half-open with {} probes in flight, rejecting call", name, requests);
                throw new TooManyRequestsException("circuit breaker '" + name + "' has too many half-open requests", name);
            }
            requests++;
            return generation;
        } finally {
            lock.unlock();
        }
    }

    private void afterRequest(final long before, final boolean success) {
        if (success) {
            callsSucceeded.inc();
        } else {
            callsFailed.inc();
        }
        lock.lock();
        try {
            final long now = clock.getAsLong();
            final CircuitBreakerState current = currentState(now);
            if (generation != before) {
                LOGGER.debug("Circuit breaker '{}' discarded a completion from generation {} (current is {})",
                        name, before, generation);
                return;
            }
            if (success) {
                onSuccess(current, now);
            } else {
                onFailure(current, now);
            }
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess(final CircuitBreakerState current, final long now) {
        totalSuccesses++;
        consecutiveSuccesses++;
        consecutiveFailures = 0;
        if (current == HALF_OPEN && consecutiveSuccesses >= maxRequests) {
            setState(CLOSED, now);
        }
    }

    private void onFailure(final CircuitBreakerState current, final long now) {
        switch (current) {
            case CLOSED:
                totalFailures++;
                consecutiveFailures++;
                consecutiveSuccesses = 0;
                if (definition.getReadyToTrip().test(counts())) {
                    setState(OPEN, now);
                }
                break;
            case HALF_OPEN:
                setState(OPEN, now);
                break;
            default:
                // an open breaker admits no call, nothing to count
        }
    }

    private CircuitBreakerState currentState(final long now) {
        if (expiring && now - expiry > 0) {
            if (state == CLOSED) {
                toNewGeneration(now);
            } else if (state == OPEN) {
                setState(HALF_OPEN, now);
            }
        }
        return state;
    }

    private void setState(final CircuitBreakerState target, final long now) {
        if (state == target) {
            return;
        }
        final CircuitBreakerState previous = state;
        state = target;
        toNewGeneration(now);
        if (target == OPEN) {
            opened.inc();
        }
        onStateChange(previous, target);
    }

    private void onStateChange(final CircuitBreakerState from, final CircuitBreakerState to) {
        LOGGER.info("Circuit breaker '{}' changed state from {} to {}", name, from, to);
        definition.getStateChangeListener().onStateChange(name, from, to);
    }

    private void toNewGeneration(final long now) {
        generation++;
        requests = 0;
        totalSuccesses = 0;
        totalFailures = 0;
        consecutiveSuccesses = 0;
        consecutiveFailures = 0;
        switch (state) {
            case CLOSED:
                expiring = true;
                expiry = now + interval;
                break;
            case OPEN:
                expiring = true;
                expiry = now + timeout;
                break;
            default:
                expiring = false;
        }
    }

    private Counts counts() {
        return new Counts(requests, totalSuccesses, totalFailures, consecutiveSuccesses, consecutiveFailures);
    }

    private long getGeneration() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    private boolean isSuccessful(final Throwable error) {
        return definition.getIsSuccessful().test(error);
    }

    @Override
    public String toString() {
        return "CircuitBreaker{name='" + name + "', state=" + getState() + '}';
    }

    private static final class Outcome<T> {
        private final T value;
        private final Throwable error;

        private Outcome(final T value, final Throwable error) {
            this.value = value;
            this.error = error;
        }

        private static <T> Outcome<T> success(final T value) {
            return new Outcome<>(value, null);
        }

        private static <T> Outcome<T> failure(final Throwable error) {
            return new Outcome<>(null, error);
        }
    }
}
