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

import java.time.Instant;

import org.apache.resilience.api.circuitbreaker.CircuitBreakerState;

/**
 * Point in time view of the calls made to one service through a {@link ServiceCircuitBreaker}.
 */
public final class CircuitBreakerMetrics {
    private final long totalRequests;
    private final long totalSuccesses;
    private final long totalFailures;
    private final long totalRejected;
    private final long stateChanges;
    private final Instant lastStateChange;
    private final CircuitBreakerState currentState;

    CircuitBreakerMetrics(final long totalRequests, final long totalSuccesses, final long totalFailures,
                          final long totalRejected, final long stateChanges, final Instant lastStateChange,
                          final CircuitBreakerState currentState) {
        this.totalRequests = totalRequests;
        this.totalSuccesses = totalSuccesses;
        this.totalFailures = totalFailures;
        this.totalRejected = totalRejected;
        this.stateChanges = stateChanges;
        this.lastStateChange = lastStateChange;
        this.currentState = currentState;
    }

    public long getTotalRequests() {
        return totalRequests;
    }

    public long getTotalSuccesses() {
        return totalSuccesses;
    }

    public long getTotalFailures() {
        return totalFailures;
    }

    public long getTotalRejected() {
        return totalRejected;
    }

    public long getStateChanges() {
        return stateChanges;
    }

    /**
     * @return when the breaker last changed state, {@code null} if it never did.
     */
    public Instant getLastStateChange() {
        return lastStateChange;
    }

    public CircuitBreakerState getCurrentState() {
        return currentState;
    }

    @Override
    public String toString() {
        return "CircuitBreakerMetrics{totalRequests=" + totalRequests + ", totalSuccesses=" + totalSuccesses
                + ", totalFailures=" + totalFailures + ", totalRejected=" + totalRejected
                + ", stateChanges=" + stateChanges + ", lastStateChange=" + lastStateChange
                + ", currentState=" + currentState + '}';
    }
}
