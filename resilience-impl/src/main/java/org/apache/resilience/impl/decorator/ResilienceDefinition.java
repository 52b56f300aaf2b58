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

package org.apache.resilience.impl.decorator;

import java.util.Optional;

import org.apache.resilience.api.bulkhead.BulkheadDefinition;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerDefinition;
import org.apache.resilience.api.ratelimiter.RateLimiterDefinition;
import org.apache.resilience.api.retry.RetryDefinition;

/**
 * Settings of every layer of a decorator; an absent layer is skipped.
 */
public final class ResilienceDefinition {
    private final CircuitBreakerDefinition circuitBreaker;
    private final BulkheadDefinition bulkhead;
    private final RateLimiterDefinition rateLimiter;
    private final RetryDefinition retry;

    public ResilienceDefinition(final CircuitBreakerDefinition circuitBreaker, final BulkheadDefinition bulkhead,
                                final RateLimiterDefinition rateLimiter, final RetryDefinition retry) {
        this.circuitBreaker = circuitBreaker;
        this.bulkhead = bulkhead;
        this.rateLimiter = rateLimiter;
        this.retry = retry;
    }

    public Optional<CircuitBreakerDefinition> getCircuitBreaker() {
        return Optional.ofNullable(circuitBreaker);
    }

    public Optional<BulkheadDefinition> getBulkhead() {
        return Optional.ofNullable(bulkhead);
    }

    public Optional<RateLimiterDefinition> getRateLimiter() {
        return Optional.ofNullable(rateLimiter);
    }

    public Optional<RetryDefinition> getRetry() {
        return Optional.ofNullable(retry);
    }

    @Override
    public String toString() {
        return "ResilienceDefinition{circuitBreaker=" + circuitBreaker + ", bulkhead=" + bulkhead
                + ", rateLimiter=" + rateLimiter + ", retry=" + retry + '}';
    }
}
