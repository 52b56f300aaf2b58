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

import java.time.Duration;
import java.util.Map;

import org.apache.resilience.api.circuitbreaker.CircuitBreaker;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerState;
import org.eclipse.microprofile.faulttolerance.exceptions.FaultToleranceDefinitionException;
import org.testng.annotations.Test;

public class CircuitBreakerManagerImplTest {
    @Test
    public void shouldReturnSameBreakerForSameName() {
        final CircuitBreakerManagerImpl manager = new CircuitBreakerManagerImpl();
        assertThat(manager.getCircuitBreaker("payments")).isSameAs(manager.getCircuitBreaker("payments"));
        assertThat(manager.getCircuitBreaker("payments")).isNotSameAs(manager.getCircuitBreaker("orders"));
    }

    @Test
    public void shouldCreateMissingBreakersWithDefaults() {
        final CircuitBreaker breaker = new CircuitBreakerManagerImpl().getCircuitBreaker("defaults");
        assertThat(breaker.getName()).isEqualTo("defaults");
        assertThat(breaker.getDefinition().getMaxRequests()).isEqualTo(5);
        assertThat(breaker.getDefinition().getInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(breaker.getDefinition().getTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    public void shouldRegisterBuiltBreakerReplacingPreviousOne() {
        final CircuitBreakerManagerImpl manager = new CircuitBreakerManagerImpl();
        final CircuitBreaker initial = manager.getCircuitBreaker("inventory");
        manager.newCircuitBreaker("inventory").withMaxRequests(1).build();

        final CircuitBreaker replaced = manager.getCircuitBreaker("inventory");
        assertThat(replaced).isNotSameAs(initial);
        assertThat(replaced.getDefinition().getMaxRequests()).isEqualTo(1);
    }

    @Test
    public void shouldListSnapshotAndRemove() {
        final CircuitBreakerManagerImpl manager = new CircuitBreakerManagerImpl();
        manager.getCircuitBreaker("a");
        manager.getCircuitBreaker("b");
        final Map<String, CircuitBreaker> list = manager.list();
        assertThat(list).containsOnlyKeys("a", "b");
        assertThatThrownBy(() -> list.remove("a")).isInstanceOf(UnsupportedOperationException.class);

        manager.remove("a");
        manager.remove("unknown");
        assertThat(manager.list()).containsOnlyKeys("b");
        assertThat(list).containsOnlyKeys("a", "b");
    }

    @Test
    public void shouldResetAllBreakers() {
        final CircuitBreakerManagerImpl manager = new CircuitBreakerManagerImpl();
        manager.getCircuitBreaker("first").transitionState(CircuitBreakerState.OPEN);
        manager.getCircuitBreaker("second").transitionState(CircuitBreakerState.HALF_OPEN);

        manager.resetAll();
        assertThat(manager.list().values()).extracting(CircuitBreaker::getState)
                .containsOnly(CircuitBreakerState.CLOSED);
    }

    @Test
    public void shouldValidateDefinitions() {
        final CircuitBreakerManagerImpl manager = new CircuitBreakerManagerImpl();
        assertThatThrownBy(() -> manager.newCircuitBreaker("invalid").withMaxRequests(-1))
                .isInstanceOf(FaultToleranceDefinitionException.class);
        assertThatThrownBy(() -> manager.newCircuitBreaker("invalid").withTimeout(Duration.ofSeconds(-1)))
                .isInstanceOf(FaultToleranceDefinitionException.class);
        assertThatThrownBy(() -> manager.newCircuitBreaker("invalid").withConsecutiveFailures(0))
                .isInstanceOf(FaultToleranceDefinitionException.class);
        assertThatThrownBy(() -> manager.newCircuitBreaker("invalid").withFailureRatio(0, 10))
                .isInstanceOf(FaultToleranceDefinitionException.class);
        assertThatThrownBy(() -> manager.newCircuitBreaker("invalid").withFailureRatio(1.5, 10))
                .isInstanceOf(FaultToleranceDefinitionException.class);
        assertThatThrownBy(() -> manager.newCircuitBreaker("invalid").withFailureRatio(0.5, 0))
                .isInstanceOf(FaultToleranceDefinitionException.class);
    }
}
