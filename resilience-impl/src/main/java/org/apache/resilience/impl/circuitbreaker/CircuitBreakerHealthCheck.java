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

import java.util.Map;
import java.util.TreeMap;

import org.apache.resilience.api.circuitbreaker.CircuitBreaker;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerManager;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerState;

/**
 * Health view over every breaker of a registry.
 */
public class CircuitBreakerHealthCheck {
    private final CircuitBreakerManager manager;

    public CircuitBreakerHealthCheck(final CircuitBreakerManager manager) {
        this.manager = manager;
    }

    /**
     * @return the state label of every registered breaker, keyed by breaker name.
     */
    public Map<String, String> check() {
        final Map<String, String> states = new TreeMap<>();
        manager.list().forEach((name, breaker) -> states.put(name, breaker.getState().getLabel()));
        return states;
    }

    public boolean isHealthy() {
        return manager.list().values().stream()
                .map(CircuitBreaker::getState)
                .allMatch(CircuitBreakerState.CLOSED::equals);
    }
}
