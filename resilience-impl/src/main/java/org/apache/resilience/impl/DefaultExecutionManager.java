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

package org.apache.resilience.impl;

import static org.apache.resilience.impl.config.ConfigurationMapper.BULKHEAD;
import static org.apache.resilience.impl.config.ConfigurationMapper.CIRCUIT_BREAKER;
import static org.apache.resilience.impl.config.ConfigurationMapper.RATE_LIMITER;
import static org.apache.resilience.impl.config.ConfigurationMapper.RETRY;

import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import javax.enterprise.inject.Vetoed;

import org.apache.resilience.api.ExecutionManager;
import org.apache.resilience.api.ResilienceDecorator;
import org.apache.resilience.impl.bulkhead.BulkheadManagerImpl;
import org.apache.resilience.impl.circuitbreaker.CircuitBreakerManagerImpl;
import org.apache.resilience.impl.config.ConfigurationMapper;
import org.apache.resilience.impl.decorator.DefaultResilienceDecorator;
import org.apache.resilience.impl.metrics.ResilienceMetrics;
import org.apache.resilience.impl.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the registries of one application. Decorators are created from configuration on first
 * use and always guard a dependency with the registry's shared breaker and bulkhead.
 */
@Vetoed
public class DefaultExecutionManager implements ExecutionManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultExecutionManager.class);

    private final ConfigurationMapper mapper;
    private final ResilienceMetrics metrics;
    private final ExecutorService executor;
    private final CircuitBreakerManagerImpl circuitBreakerManager;
    private final BulkheadManagerImpl bulkheadManager;
    private final ConcurrentMap<String, ResilienceDecorator> decorators = new ConcurrentHashMap<>();

    public DefaultExecutionManager() {
        this(new ConfigurationMapper(), ResilienceMetrics.create());
    }

    public DefaultExecutionManager(final ConfigurationMapper mapper, final ResilienceMetrics metrics) {
        this.mapper = mapper;
        this.metrics = metrics;
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory("resilience-execution-"));
        this.circuitBreakerManager = new CircuitBreakerManagerImpl(mapper::mapCircuitBreaker, metrics, executor);
        this.bulkheadManager = new BulkheadManagerImpl(mapper::mapBulkhead, metrics);
    }

    @Override
    public CircuitBreakerManagerImpl getCircuitBreakerManager() {
        return circuitBreakerManager;
    }

    @Override
    public BulkheadManagerImpl getBulkheadManager() {
        return bulkheadManager;
    }

    public ResilienceMetrics getMetrics() {
        return metrics;
    }

    public ConfigurationMapper getConfigurationMapper() {
        return mapper;
    }

    @Override
    public ResilienceDecorator getDecorator(final String name) {
        ResilienceDecorator decorator = decorators.get(name);
        if (decorator == null) {
            decorator = create(name);
            final ResilienceDecorator existing = decorators.putIfAbsent(name, decorator);
            if (existing != null) {
                decorator = existing;
            }
        }
        return decorator;
    }

    @Override
    public <T> T execute(final String name, final Callable<T> callable) throws Exception {
        return getDecorator(name).execute(callable);
    }

    @Override
    public void close() {
        decorators.clear();
        executor.shutdownNow();
        LOGGER.debug("Execution manager closed");
    }

    private ResilienceDecorator create(final String name) {
        final DefaultResilienceDecorator.Builder builder = DefaultResilienceDecorator.builder()
                .withMetrics(metrics)
                .withExecutor(executor);
        if (mapper.isEnabled(name, RETRY)) {
            builder.withRetry(mapper.mapRetry(name));
        }
        if (mapper.isEnabled(name, RATE_LIMITER)) {
            builder.withRateLimiter(mapper.mapRateLimiter(name));
        }
        if (mapper.isEnabled(name, BULKHEAD)) {
            builder.withBulkhead(bulkheadManager.getBulkhead(name));
        }
        if (mapper.isEnabled(name, CIRCUIT_BREAKER)) {
            builder.withCircuitBreaker(circuitBreakerManager.getCircuitBreaker(name));
        }
        return builder.build();
    }
}
