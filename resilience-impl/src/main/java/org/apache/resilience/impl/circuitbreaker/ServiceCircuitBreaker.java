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

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.resilience.api.CallContext;
import org.apache.resilience.api.ContextualCallable;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerDefinition;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerState;
import org.apache.resilience.api.circuitbreaker.StateChangeListener;
import org.apache.resilience.exception.CircuitOpenException;
import org.apache.resilience.exception.TooManyRequestsException;
import org.apache.resilience.impl.metrics.ResilienceMetrics;

/**
 * One breaker per called service, all sharing the same settings, with per-service call
 * statistics.
 */
public class ServiceCircuitBreaker {
    private final CircuitBreakerManagerImpl registry;
    private final ConcurrentMap<String, ServiceStats> stats = new ConcurrentHashMap<>();
    private final Clock clock;

    public ServiceCircuitBreaker(final CircuitBreakerDefinition template) {
        this(template, ResilienceMetrics.noop(), CircuitBreakerImpl.DEFAULT_EXECUTOR, Clock.systemUTC());
    }

    public ServiceCircuitBreaker(final CircuitBreakerDefinition template, final ResilienceMetrics metrics,
                                 final ExecutorService executor, final Clock clock) {
        this.clock = clock;
        this.registry = new CircuitBreakerManagerImpl(service -> {
            final StateChangeListener delegate = template.getStateChangeListener();
            return CircuitBreakerBuilderImpl.from(service, template)
                    .withStateChangeListener((name, from, to) -> {
                        stats(name).stateChanged(to, clock.instant());
                        delegate.onStateChange(name, from, to);
                    })
                    .build();
        }, metrics, executor);
    }

    public <T> T call(final CallContext context, final String serviceName,
                      final ContextualCallable<T> callable) throws Exception {
        final CircuitBreakerImpl breaker = registry.getCircuitBreaker(serviceName);
        final ServiceStats serviceStats = stats(serviceName);
        serviceStats.requests.incrementAndGet();
        try {
            final T result = breaker.executeWithContext(context, callable);
            serviceStats.successes.incrementAndGet();
            return result;
        } catch (final CircuitOpenException | TooManyRequestsException rejected) {
            if (FallbackCircuitBreaker.isRejectedBy(rejected, breaker.getName())) {
                serviceStats.rejected.incrementAndGet();
            } else {
                serviceStats.failures.incrementAndGet();
            }
            throw rejected;
        } catch (final Exception | Error e) {
            serviceStats.failures.incrementAndGet();
            throw e;
        }
    }

    public CircuitBreakerState getState(final String serviceName) {
        return registry.getCircuitBreaker(serviceName).getState();
    }

    /**
     * @return the statistics of {@code serviceName}, {@code null} if it was never called.
     */
    public CircuitBreakerMetrics getMetrics(final String serviceName) {
        final ServiceStats serviceStats = stats.get(serviceName);
        if (serviceStats == null) {
            return null;
        }
        return serviceStats.snapshot(registry.getCircuitBreaker(serviceName).getState());
    }

    public void reset(final String serviceName) {
        registry.getCircuitBreaker(serviceName).reset();
    }

    CircuitBreakerManagerImpl getRegistry() {
        return registry;
    }

    private ServiceStats stats(final String serviceName) {
        return stats.computeIfAbsent(serviceName, k -> new ServiceStats());
    }

    private static final class ServiceStats {
        private final AtomicLong requests = new AtomicLong();
        private final AtomicLong successes = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();
        private final AtomicLong rejected = new AtomicLong();
        private final AtomicLong stateChanges = new AtomicLong();
        private final AtomicReference<Instant> lastStateChange = new AtomicReference<>();

        private void stateChanged(final CircuitBreakerState state, final Instant when) {
            stateChanges.incrementAndGet();
            lastStateChange.set(when);
        }

        private CircuitBreakerMetrics snapshot(final CircuitBreakerState state) {
            return new CircuitBreakerMetrics(requests.get(), successes.get(), failures.get(), rejected.get(),
                    stateChanges.get(), lastStateChange.get(), state);
        }
    }
}
