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

import static java.util.Collections.unmodifiableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

import javax.enterprise.inject.Vetoed;

import org.apache.resilience.api.circuitbreaker.CircuitBreaker;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerDefinition;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerManager;
import org.apache.resilience.impl.metrics.InMemoryResilienceMetrics;
import org.apache.resilience.impl.metrics.ResilienceMetrics;

@Vetoed
public class CircuitBreakerManagerImpl implements CircuitBreakerManager {
    private final ConcurrentMap<String, CircuitBreakerImpl> circuitBreakers = new ConcurrentHashMap<>();
    private final Function<String, CircuitBreakerDefinition> defaults;
    private final ResilienceMetrics metrics;
    private final ExecutorService executor;

    public CircuitBreakerManagerImpl() {
        this(name -> new CircuitBreakerBuilderImpl(name).build(), new InMemoryResilienceMetrics(),
                CircuitBreakerImpl.DEFAULT_EXECUTOR);
    }

    /**
     * @param defaults definition of a breaker requested through {@link #getCircuitBreaker(String)}
     *                 before anything was registered under its name.
     */
    public CircuitBreakerManagerImpl(final Function<String, CircuitBreakerDefinition> defaults,
                                     final ResilienceMetrics metrics, final ExecutorService executor) {
        this.defaults = defaults;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * The returned builder registers a new breaker under {@code name} when built, replacing
     * any breaker already registered there.
     */
    @Override
    public CircuitBreakerBuilderImpl newCircuitBreaker(final String name) {
        return new CircuitBreakerBuilderImpl(name, this);
    }

    @Override
    public CircuitBreakerImpl getCircuitBreaker(final String name) {
        CircuitBreakerImpl circuitBreaker = circuitBreakers.get(name);
        if (circuitBreaker == null) {
            circuitBreaker = create(defaults.apply(name));
            final CircuitBreakerImpl existing = circuitBreakers.putIfAbsent(name, circuitBreaker);
            if (existing != null) {
                circuitBreaker = existing;
            }
        }
        return circuitBreaker;
    }

    @Override
    public void remove(final String name) {
        circuitBreakers.remove(name);
    }

    @Override
    public Map<String, CircuitBreaker> list() {
        return unmodifiableMap(new LinkedHashMap<>(circuitBreakers));
    }

    @Override
    public void resetAll() {
        circuitBreakers.values().forEach(CircuitBreakerImpl::reset);
    }

    void register(final String name, final CircuitBreakerDefinition definition) {
        circuitBreakers.put(name, create(definition));
    }

    private CircuitBreakerImpl create(final CircuitBreakerDefinition definition) {
        return new CircuitBreakerImpl(definition, metrics, executor);
    }
}
