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

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import org.apache.resilience.api.circuitbreaker.CircuitBreakerDefinition;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerState;
import org.apache.resilience.impl.metrics.ResilienceMetrics;

/**
 * Guards a service with one breaker for the whole service and one breaker per operation,
 * created on first use. A failing operation opens its own breaker first; the service breaker
 * sees every outcome, rejections by an operation breaker included, and cuts all operations
 * off once it opens.
 */
public class TwoLevelCircuitBreaker {
    private final CircuitBreakerImpl service;
    private final CircuitBreakerManagerImpl operations;

    public TwoLevelCircuitBreaker(final CircuitBreakerDefinition service, final CircuitBreakerDefinition operation) {
        this(service, operation, ResilienceMetrics.noop(), CircuitBreakerImpl.DEFAULT_EXECUTOR);
    }

    public TwoLevelCircuitBreaker(final CircuitBreakerDefinition service, final CircuitBreakerDefinition operation,
                                  final ResilienceMetrics metrics, final ExecutorService executor) {
        final String serviceName = service.getName();
        this.service = new CircuitBreakerImpl(service, metrics, executor);
        this.operations = new CircuitBreakerManagerImpl(
                name -> CircuitBreakerBuilderImpl.from(serviceName + '.' + name, operation).build(),
                metrics, executor);
    }

    public <T> T execute(final String operation, final Callable<T> callable) throws Exception {
        return service.execute(() -> operations.getCircuitBreaker(operation).execute(callable));
    }

    public CircuitBreakerState getServiceState() {
        return service.getState();
    }

    public CircuitBreakerState getOperationState(final String operation) {
        return operations.getCircuitBreaker(operation).getState();
    }

    public String getName() {
        return service.getName();
    }

    CircuitBreakerImpl getService() {
        return service;
    }

    CircuitBreakerManagerImpl getOperations() {
        return operations;
    }
}
