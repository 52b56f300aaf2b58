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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.Properties;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.resilience.api.CallContext;
import org.apache.resilience.api.ResilienceDecorator;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerState;
import org.apache.resilience.exception.RetryException;
import org.apache.resilience.impl.config.ConfigurationMapper;
import org.apache.resilience.impl.config.DefaultConfigFacade;
import org.apache.resilience.impl.decorator.DefaultResilienceDecorator;
import org.apache.resilience.impl.metrics.InMemoryResilienceMetrics;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class DefaultExecutionManagerTest {
    private InMemoryResilienceMetrics metrics;
    private DefaultExecutionManager manager;

    @BeforeMethod
    public void init() {
        final Properties properties = new Properties();
        properties.setProperty("Retry/initialDelay", "0");
        properties.setProperty("Retry/maxAttempts", "2");
        properties.setProperty("CircuitBreaker/consecutiveFailures", "2");
        properties.setProperty("guarded/Bulkhead/enabled", "true");
        properties.setProperty("guarded/Bulkhead/maxConcurrentExecutions", "3");
        properties.setProperty("unguarded/Retry/enabled", "false");
        properties.setProperty("unguarded/CircuitBreaker/enabled", "false");
        metrics = new InMemoryResilienceMetrics();
        manager = new DefaultExecutionManager(new ConfigurationMapper(new DefaultConfigFacade(properties)), metrics);
    }

    @AfterMethod
    public void close() {
        manager.close();
    }

    @Test
    public void decoratorsAreCachedAndUseSharedRegistries() {
        final ResilienceDecorator decorator = manager.getDecorator("guarded");
        assertThat(manager.getDecorator("guarded")).isSameAs(decorator);

        final DefaultResilienceDecorator impl = (DefaultResilienceDecorator) decorator;
        assertThat(impl.getCircuitBreaker()).isSameAs(manager.getCircuitBreakerManager().getCircuitBreaker("guarded"));
        assertThat(impl.getBulkhead()).isSameAs(manager.getBulkheadManager().getBulkhead("guarded"));
        assertThat(impl.getBulkhead().getAvailableSlots()).isEqualTo(3);
        assertThat(impl.getRetryer().getDefinition().getMaxAttempts()).isEqualTo(2);
        assertThat(impl.getRateLimiter()).isNull();
    }

    @Test
    public void disabledLayersAreSkipped() throws Exception {
        final DefaultResilienceDecorator decorator = (DefaultResilienceDecorator) manager.getDecorator("unguarded");
        assertThat(decorator.getRetryer()).isNull();
        assertThat(decorator.getCircuitBreaker()).isNull();
        assertThat(decorator.getBulkhead()).isNull();

        final IOException failure = new IOException("raw");
        assertThatThrownBy(() -> manager.execute("unguarded", () -> {
            throw failure;
        })).isSameAs(failure);
    }

    @Test
    public void executeRetriesThenTripsSharedBreaker() throws Exception {
        final AtomicInteger calls = new AtomicInteger();
        assertThat(manager.execute("guarded", () -> "ok")).isEqualTo("ok");
        assertThatThrownBy(() -> manager.execute("guarded", () -> {
            calls.incrementAndGet();
            throw new IOException("down");
        })).isInstanceOf(RetryException.class);

        assertThat(calls).hasValue(2);
        assertThat(manager.getCircuitBreakerManager().getCircuitBreaker("guarded").getState())
                .isEqualTo(CircuitBreakerState.OPEN);
        assertThat(metrics.snapshot())
                .containsEntry("resilience.circuitbreaker.guarded.callsSucceeded.total", 1L)
                .containsEntry("resilience.circuitbreaker.guarded.callsFailed.total", 2L)
                .containsEntry("resilience.retry.guarded.callsFailed.total", 1L);
    }

    @Test
    public void closeStopsContextualExecutions() {
        final ResilienceDecorator decorator = manager.getDecorator("unretried");
        manager.close();
        assertThatThrownBy(() -> decorator.executeWithContext(CallContext.background(), ctx -> "late"))
                .isInstanceOf(RetryException.class)
                .hasCauseInstanceOf(RejectedExecutionException.class);
    }
}
