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

import java.util.concurrent.atomic.AtomicReference;

import org.apache.resilience.exception.CircuitOpenException;
import org.apache.resilience.exception.TooManyRequestsException;
import org.eclipse.microprofile.faulttolerance.exceptions.FaultToleranceException;
import org.testng.annotations.Test;

public class FallbackCircuitBreakerTest {
    @Test
    public void shouldUseFallbackOnlyWhenRejected() throws Exception {
        final FallbackCircuitBreaker breaker = new FallbackCircuitBreaker(new CircuitBreakerImpl(
                new CircuitBreakerBuilderImpl("fallback").withConsecutiveFailures(1).build()));
        final AtomicReference<FaultToleranceException> rejection = new AtomicReference<>();

        final String live = breaker.executeWithFallback(() -> "live", e -> "cached");
        assertThat(live).isEqualTo("live");
        assertThatThrownBy(() -> breaker.executeWithFallback(() -> {
            throw new IllegalStateException("down");
        }, e -> "cached")).isInstanceOf(IllegalStateException.class);

        final String cached = breaker.executeWithFallback(() -> "live", e -> {
            rejection.set(e);
            return "cached";
        });
        assertThat(cached).isEqualTo("cached");
        assertThat(rejection.get()).isInstanceOf(CircuitOpenException.class);
        assertThat(breaker.getDelegate().getName()).isEqualTo("fallback");
    }

    @Test
    public void shouldPropagateRejectionsOfNestedBreakers() {
        final FallbackCircuitBreaker breaker = new FallbackCircuitBreaker(new CircuitBreakerImpl(
                new CircuitBreakerBuilderImpl("outer").build()));
        final CircuitOpenException open = new CircuitOpenException("inner");
        final TooManyRequestsException busy = new TooManyRequestsException("busy", "inner");

        assertThatThrownBy(() -> breaker.executeWithFallback(() -> {
            throw open;
        }, e -> "cached")).isSameAs(open);
        assertThatThrownBy(() -> breaker.executeWithFallback(() -> {
            throw busy;
        }, e -> "cached")).isSameAs(busy);
    }
}
