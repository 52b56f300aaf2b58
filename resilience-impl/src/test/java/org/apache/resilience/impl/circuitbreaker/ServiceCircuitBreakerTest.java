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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.apache.resilience.api.CallContext;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerState;
import org.apache.resilience.exception.CircuitOpenException;
import org.apache.resilience.impl.metrics.ResilienceMetrics;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class ServiceCircuitBreakerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private final List<String> notifications = new ArrayList<>();
    private ServiceCircuitBreaker breakers;

    @BeforeMethod
    public void init() {
        notifications.clear();
        breakers = new ServiceCircuitBreaker(new CircuitBreakerBuilderImpl("template")
                .withConsecutiveFailures(2)
                .withStateChangeListener((name, from, to) -> notifications.add(name + ":" + to))
                .build(), ResilienceMetrics.noop(), CircuitBreakerImpl.DEFAULT_EXECUTOR, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void shouldIsolateServices() throws Exception {
        failOn("users");
        failOn("users");

        assertThat(breakers.getState("users")).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(breakers.getState("orders")).isEqualTo(CircuitBreakerState.CLOSED);
        final String orders = breakers.call(CallContext.background(), "orders", ctx -> "ok");
        assertThat(orders).isEqualTo("ok");
        assertThat(breakers.getRegistry().list()).containsOnlyKeys("users", "orders");
        assertThat(notifications).containsExactly("users:open");
    }

    @Test
    public void shouldTrackPerServiceStatistics() throws Exception {
        assertThat(breakers.getMetrics("users")).isNull();

        breakers.call(CallContext.background(), "users", ctx -> "ok");
        failOn("users");
        failOn("users");
        assertThatThrownBy(() -> breakers.call(CallContext.background(), "users", ctx -> "rejected"))
                .isInstanceOf(CircuitOpenException.class);

        final CircuitBreakerMetrics metrics = breakers.getMetrics("users");
        assertThat(metrics.getTotalRequests()).isEqualTo(4);
        assertThat(metrics.getTotalSuccesses()).isEqualTo(1);
        assertThat(metrics.getTotalFailures()).isEqualTo(2);
        assertThat(metrics.getTotalRejected()).isEqualTo(1);
        assertThat(metrics.getStateChanges()).isEqualTo(1);
        assertThat(metrics.getLastStateChange()).isEqualTo(NOW);
        assertThat(metrics.getCurrentState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    public void shouldCountRejectionOfNestedBreakerAsFailure() {
        final CircuitOpenException nested = new CircuitOpenException("inventory");
        assertThatThrownBy(() -> breakers.call(CallContext.background(), "orders", ctx -> {
            throw nested;
        })).isSameAs(nested);

        final CircuitBreakerMetrics metrics = breakers.getMetrics("orders");
        assertThat(metrics.getTotalFailures()).isEqualTo(1);
        assertThat(metrics.getTotalRejected()).isZero();
    }

    @Test
    public void shouldResetOneService() throws Exception {
        failOn("users");
        failOn("users");
        breakers.reset("users");

        assertThat(breakers.getState("users")).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breakers.getMetrics("users").getStateChanges()).isEqualTo(2);
        assertThat(notifications).containsExactly("users:open", "users:closed");
    }

    private void failOn(final String service) {
        assertThatThrownBy(() -> breakers.call(CallContext.background(), service, ctx -> {
            throw new IllegalStateException("unavailable");
        })).isInstanceOf(IllegalStateException.class);
    }
}
