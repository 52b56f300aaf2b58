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

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

import org.apache.resilience.api.circuitbreaker.CircuitBreakerBuilder;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerDefinition;
import org.apache.resilience.api.circuitbreaker.Counts;
import org.apache.resilience.api.circuitbreaker.StateChangeListener;
import org.eclipse.microprofile.faulttolerance.exceptions.FaultToleranceDefinitionException;

/**
 * Builds circuit breaker definitions. Zero values fall back to the defaults: 5 half-open
 * probes, a 60s closed window, a 30s open timeout and tripping once more than 5 consecutive
 * failures were seen.
 *
 * <p>The trip policy is either a custom {@link #withReadyToTrip(Predicate) predicate} or the
 * combination of a consecutive failure threshold and an optional failure ratio; whichever
 * was configured last wins.</p>
 */
public class CircuitBreakerBuilderImpl implements CircuitBreakerBuilder {
    static final int DEFAULT_MAX_REQUESTS = 5;
    static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(60);
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    static final Predicate<Counts> DEFAULT_READY_TO_TRIP = counts -> counts.getConsecutiveFailures() > 5;

    private final String name;
    private final CircuitBreakerManagerImpl manager;
    private int maxRequests;
    private Duration interval = Duration.ZERO;
    private Duration timeout = Duration.ZERO;
    private Predicate<Counts> readyToTrip;
    private int consecutiveFailures;
    private double failureRatio;
    private int minRequests;
    private Predicate<Throwable> isSuccessful = Objects::isNull;
    private StateChangeListener stateChangeListener = StateChangeListener.NONE;

    public CircuitBreakerBuilderImpl(final String name) {
        this(name, null);
    }

    CircuitBreakerBuilderImpl(final String name, final CircuitBreakerManagerImpl manager) {
        this.name = requireNonNull(name, "name");
        this.manager = manager;
    }

    /**
     * @return a standalone builder preset with every setting of {@code template} but its name.
     */
    public static CircuitBreakerBuilderImpl from(final String name, final CircuitBreakerDefinition template) {
        return new CircuitBreakerBuilderImpl(name)
                .withMaxRequests(template.getMaxRequests())
                .withInterval(template.getInterval())
                .withTimeout(template.getTimeout())
                .withReadyToTrip(template.getReadyToTrip())
                .withIsSuccessful(template.getIsSuccessful())
                .withStateChangeListener(template.getStateChangeListener());
    }

    @Override
    public CircuitBreakerBuilderImpl withMaxRequests(final int maxRequests) {
        if (maxRequests < 0) {
            throw new FaultToleranceDefinitionException("CircuitBreaker maxRequests can't be < 0");
        }
        this.maxRequests = maxRequests;
        return this;
    }

    @Override
    public CircuitBreakerBuilderImpl withInterval(final Duration interval) {
        if (interval.isNegative()) {
            throw new FaultToleranceDefinitionException("CircuitBreaker interval can't be < 0");
        }
        this.interval = interval;
        return this;
    }

    @Override
    public CircuitBreakerBuilderImpl withTimeout(final Duration timeout) {
        if (timeout.isNegative()) {
            throw new FaultToleranceDefinitionException("CircuitBreaker timeout can't be < 0");
        }
        this.timeout = timeout;
        return this;
    }

    @Override
    public CircuitBreakerBuilderImpl withReadyToTrip(final Predicate<Counts> readyToTrip) {
        this.readyToTrip = requireNonNull(readyToTrip, "readyToTrip");
        return this;
    }

    /**
     * Trips the breaker as soon as {@code threshold} consecutive failures were recorded.
     */
    @Override
    public CircuitBreakerBuilderImpl withConsecutiveFailures(final int threshold) {
        if (threshold < 1) {
            throw new FaultToleranceDefinitionException("CircuitBreaker failure threshold can't be < 1");
        }
        this.consecutiveFailures = threshold;
        this.readyToTrip = null;
        return this;
    }

    /**
     * Also trips the breaker once at least {@code minRequests} calls were seen in the current
     * window and {@code ratio} of them or more failed. The consecutive failure threshold keeps
     * applying.
     */
    @Override
    public CircuitBreakerBuilderImpl withFailureRatio(final double ratio, final int minRequests) {
        if (ratio <= 0 || ratio > 1) {
            throw new FaultToleranceDefinitionException("CircuitBreaker failure ratio must be in ]0, 1]");
        }
        if (minRequests < 1) {
            throw new FaultToleranceDefinitionException("CircuitBreaker minRequests can't be < 1");
        }
        this.failureRatio = ratio;
        this.minRequests = minRequests;
        this.readyToTrip = null;
        return this;
    }

    @Override
    public CircuitBreakerBuilderImpl withIsSuccessful(final Predicate<Throwable> isSuccessful) {
        this.isSuccessful = requireNonNull(isSuccessful, "isSuccessful");
        return this;
    }

    @Override
    public CircuitBreakerBuilderImpl withStateChangeListener(final StateChangeListener listener) {
        this.stateChangeListener = requireNonNull(listener, "listener");
        return this;
    }

    @Override
    public CircuitBreakerDefinitionImpl build() {
        final CircuitBreakerDefinitionImpl definition = new CircuitBreakerDefinitionImpl(
                name,
                maxRequests == 0 ? DEFAULT_MAX_REQUESTS : maxRequests,
                interval.isZero() ? DEFAULT_INTERVAL : interval,
                timeout.isZero() ? DEFAULT_TIMEOUT : timeout,
                readyToTrip == null ? thresholdPolicy() : readyToTrip, isSuccessful, stateChangeListener);
        if (manager != null) {
            manager.register(name, definition);
        }
        return definition;
    }

    private Predicate<Counts> thresholdPolicy() {
        final int threshold = consecutiveFailures;
        final Predicate<Counts> consecutive = threshold == 0
                ? DEFAULT_READY_TO_TRIP : counts -> counts.getConsecutiveFailures() >= threshold;
        if (minRequests == 0) {
            return consecutive;
        }
        final double ratio = failureRatio;
        final int min = minRequests;
        return consecutive.or(counts -> counts.getRequests() >= min && counts.getFailureRatio() >= ratio);
    }
}
