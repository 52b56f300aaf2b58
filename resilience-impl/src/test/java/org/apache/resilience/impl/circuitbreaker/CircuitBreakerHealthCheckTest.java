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
import static org.assertj.core.api.Assertions.entry;

import org.apache.resilience.api.circuitbreaker.CircuitBreakerState;
import org.testng.annotations.Test;

public class CircuitBreakerHealthCheckTest {
    @Test
    public void shouldBeHealthyWithoutBreakers() {
        final CircuitBreakerHealthCheck check = new CircuitBreakerHealthCheck(new CircuitBreakerManagerImpl());
        assertThat(check.isHealthy()).isTrue();
        assertThat(check.check()).isEmpty();
    }

    @Test
    public void shouldReportStateOfEveryBreaker() {
        final CircuitBreakerManagerImpl manager = new CircuitBreakerManagerImpl();
        manager.getCircuitBreaker("search");
        manager.getCircuitBreaker("billing");
        final CircuitBreakerHealthCheck check = new CircuitBreakerHealthCheck(manager);
        assertThat(check.isHealthy()).isTrue();

        manager.getCircuitBreaker("billing").transitionState(CircuitBreakerState.HALF_OPEN);
        assertThat(check.isHealthy()).isFalse();
        assertThat(check.check()).containsExactly(entry("billing", "half-open"), entry("search", "closed"));

        manager.getCircuitBreaker("billing").transitionState(CircuitBreakerState.OPEN);
        assertThat(check.check()).containsEntry("billing", "open");
    }
}
