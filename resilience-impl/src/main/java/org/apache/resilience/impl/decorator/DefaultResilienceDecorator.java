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

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import org.apache.resilience.api.CallContext;
import org.apache.resilience.api.ContextualCallable;
import org.apache.resilience.api.ResilienceDecorator;
import org.apache.resilience.api.bulkhead.Bulkhead;
import org.apache.resilience.api.bulkhead.BulkheadDefinition;
import org.apache.resilience.api.circuitbreaker.CircuitBreaker;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerDefinition;
import org.apache.resilience.api.ratelimiter.RateLimiter;
import org.apache.resilience.api.ratelimiter.RateLimiterDefinition;
import org.apache.resilience.api.retry.RetryDefinition;
import org.apache.resilience.api.retry.Retryer;
import org.apache.resilience.impl.bulkhead.SemaphoreBulkhead;
import org.apache.resilience.impl.circuitbreaker.CircuitBreakerImpl;
import org.apache.resilience.impl.metrics.ResilienceMetrics;
import org.apache.resilience.impl.ratelimiter.TokenBucketRateLimiter;
import org.apache.resilience.impl.retry.DefaultRetryer;

/**
 * Nests retry, rate limiter, bulkhead and circuit breaker around an operation, from the
 * outermost to the innermost. Every retry attempt goes through the other layers again, so an
 * open breaker fails the attempt fast.
 */
public class DefaultResilienceDecorator implements ResilienceDecorator {
    private final Retryer retryer;
    private final RateLimiter rateLimiter;
    private final Bulkhead bulkhead;
    private final CircuitBreaker circuitBreaker;

    public DefaultResilienceDecorator(final ResilienceDefinition definition) {
        this(builder()
                .withRetry(definition.getRetry().orElse(null))
                .withRateLimiter(definition.getRateLimiter().orElse(null))
                .withBulkhead(definition.getBulkhead().orElse(null))
                .withCircuitBreaker(definition.getCircuitBreaker().orElse(null))
                .instantiate());
    }

    private DefaultResilienceDecorator(final Builder builder) {
        this.retryer = builder.retryer;
        this.rateLimiter = builder.rateLimiter;
        this.bulkhead = builder.bulkhead;
        this.circuitBreaker = builder.circuitBreaker;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public <T> T execute(final Callable<T> callable) throws Exception {
        Callable<T> chain = callable;
        if (circuitBreaker != null) {
            final Callable<T> inner = chain;
            chain = () -> circuitBreaker.execute(inner);
        }
        if (bulkhead != null) {
            final Callable<T> inner = chain;
            chain = () -> bulkhead.execute(inner);
        }
        if (rateLimiter != null) {
            final Callable<T> inner = chain;
            chain = () -> {
                rateLimiter.acquire(CallContext.background());
                return inner.call();
            };
        }
        if (retryer != null) {
            final Callable<T> inner = chain;
            return retryer.call(CallContext.background(), context -> inner.call());
        }
        return chain.call();
    }

    @Override
    public <T> T executeWithContext(final CallContext context, final ContextualCallable<T> callable) throws Exception {
        ContextualCallable<T> chain = callable;
        if (circuitBreaker != null) {
            final ContextualCallable<T> inner = chain;
            chain = ctx -> circuitBreaker.executeWithContext(ctx, inner);
        }
        if (bulkhead != null) {
            final ContextualCallable<T> inner = chain;
            chain = ctx -> bulkhead.executeWithContext(ctx, inner);
        }
        if (rateLimiter != null) {
            final ContextualCallable<T> inner = chain;
            chain = ctx -> rateLimiter.execute(ctx, inner);
        }
        if (retryer != null) {
            return retryer.call(context, chain);
        }
        return chain.call(context);
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public Bulkhead getBulkhead() {
        return bulkhead;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public Retryer getRetryer() {
        return retryer;
    }

    /**
     * Each layer is given either as a definition, instantiated at build time, or as an
     * existing instance to share it with other decorators.
     */
    public static final class Builder {
        private ResilienceMetrics metrics = ResilienceMetrics.noop();
        private ExecutorService executor;
        private Retryer retryer;
        private RetryDefinition retryDefinition;
        private RateLimiter rateLimiter;
        private Bulkhead bulkhead;
        private BulkheadDefinition bulkheadDefinition;
        private CircuitBreaker circuitBreaker;
        private CircuitBreakerDefinition circuitBreakerDefinition;

        private Builder() {
            // no-op
        }

        public Builder withMetrics(final ResilienceMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder withRetry(final RetryDefinition definition) {
            this.retryDefinition = definition;
            this.retryer = null;
            return this;
        }

        public Builder withRetry(final Retryer retryer) {
            this.retryer = retryer;
            this.retryDefinition = null;
            return this;
        }

        public Builder withRateLimiter(final RateLimiterDefinition definition) {
            this.rateLimiter = definition == null ? null : new TokenBucketRateLimiter(definition);
            return this;
        }

        public Builder withRateLimiter(final RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder withBulkhead(final BulkheadDefinition definition) {
            this.bulkheadDefinition = definition;
            this.bulkhead = null;
            return this;
        }

        public Builder withBulkhead(final Bulkhead bulkhead) {
            this.bulkhead = bulkhead;
            this.bulkheadDefinition = null;
            return this;
        }

        public Builder withCircuitBreaker(final CircuitBreakerDefinition definition) {
            this.circuitBreakerDefinition = definition;
            this.circuitBreaker = null;
            return this;
        }

        public Builder withCircuitBreaker(final CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            this.circuitBreakerDefinition = null;
            return this;
        }

        public Builder withExecutor(final ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public DefaultResilienceDecorator build() {
            return new DefaultResilienceDecorator(instantiate());
        }

        private Builder instantiate() {
            if (retryDefinition != null) {
                retryer = new DefaultRetryer(retryDefinition, metrics);
            }
            if (bulkheadDefinition != null) {
                bulkhead = new SemaphoreBulkhead(bulkheadDefinition, metrics);
            }
            if (circuitBreakerDefinition != null) {
                circuitBreaker = executor == null
                        ? new CircuitBreakerImpl(circuitBreakerDefinition, metrics)
                        : new CircuitBreakerImpl(circuitBreakerDefinition, metrics, executor);
            }
            return this;
        }
    }
}
