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

import static org.apache.resilience.api.circuitbreaker.CircuitBreakerState.OPEN;

import java.util.concurrent.Callable;

import org.apache.resilience.api.circuitbreaker.CircuitBreakerDefinition;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerState;
import org.apache.resilience.api.circuitbreaker.StateChangeListener;
import org.apache.resilience.exception.CircuitOpenException;
import org.apache.resilience.exception.TooManyRequestsException;
import org.apache.resilience.impl.metrics.ResilienceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stacks two breakers: the primary one reacts to transient failures, the secondary one counts
 * how often the primary trips and stays open when the dependency keeps failing.
 */
public class TwoPhaseCircuitBreaker {
    private static final Logger LOGGER = LoggerFactory.getLogger(TwoPhaseCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerImpl secondary;
    private final CircuitBreakerImpl primary;

    public TwoPhaseCircuitBreaker(final String name, final CircuitBreakerDefinition primary,
                                  final CircuitBreakerDefinition secondary) {
        this(name, primary, secondary, ResilienceMetrics.noop());
    }

    public TwoPhaseCircuitBreaker(final String name, final CircuitBreakerDefinition primary,
                                  final CircuitBreakerDefinition secondary, final ResilienceMetrics metrics) {
        this.name = name;
        this.secondary = new CircuitBreakerImpl(
                CircuitBreakerBuilderImpl.from(name + "-secondary", secondary).build(),
                metrics, CircuitBreakerImpl.DEFAULT_EXECUTOR);
        final StateChangeListener primaryListener = primary.getStateChangeListener();
        this.primary = new CircuitBreakerImpl(
                CircuitBreakerBuilderImpl.from(name + "-primary", primary)
                        .withStateChangeListener((breaker, from, to) -> {
                            if (to == OPEN) {
                                onPrimaryTrip();
                            }
                            primaryListener.onStateChange(breaker, from, to);
                        })
                        .build(),
                metrics, CircuitBreakerImpl.DEFAULT_EXECUTOR);
    }

    public <T> T execute(final Callable<T> callable) throws Exception {
        if (secondary.getState() == OPEN) {
            throw new CircuitOpenException(name);
        }
        return primary.execute(callable);
    }

    /**
     * @return {@link CircuitBreakerState#OPEN} while the secondary breaker is open, the state
     * of the primary one otherwise.
     */
    public CircuitBreakerState getState() {
        if (secondary.getState() == OPEN) {
            return OPEN;
        }
        return primary.getState();
    }

    public String getName() {
        return name;
    }

    CircuitBreakerImpl getPrimary() {
        return primary;
    }

    CircuitBreakerImpl getSecondary() {
        return secondary;
    }

    private void onPrimaryTrip() {
        try {
            secondary.recordFailure();
        } catch (final CircuitOpenException | TooManyRequestsException rejected) {
            LOGGER.debug("Secondary circuit breaker of '{}' did not count a primary trip: {}", name, rejected.getMessage());
        }
    }
}
