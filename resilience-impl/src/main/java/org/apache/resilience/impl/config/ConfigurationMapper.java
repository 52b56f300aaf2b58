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

package org.apache.resilience.impl.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import org.apache.resilience.api.config.ConfigFacade;
import org.apache.resilience.impl.bulkhead.BulkheadBuilderImpl;
import org.apache.resilience.impl.bulkhead.BulkheadDefinitionImpl;
import org.apache.resilience.impl.circuitbreaker.CircuitBreakerBuilderImpl;
import org.apache.resilience.impl.circuitbreaker.CircuitBreakerDefinitionImpl;
import org.apache.resilience.impl.decorator.ResilienceDefinition;
import org.apache.resilience.impl.ratelimiter.RateLimiterDefinitionImpl;
import org.apache.resilience.impl.retry.RetryBuilderImpl;
import org.apache.resilience.impl.retry.RetryDefinitionImpl;

/**
 * Builds definitions from configuration. A property is looked up as
 * {@code <name>/<Primitive>/<property>}, then as {@code <Primitive>/<property>}; durations are
 * numbers expressed in the {@link ChronoUnit} of {@code <property>Unit}, milliseconds by default.
 */
public class ConfigurationMapper {
    public static final String CIRCUIT_BREAKER = "CircuitBreaker";
    public static final String BULKHEAD = "Bulkhead";
    public static final String RATE_LIMITER = "RateLimiter";
    public static final String RETRY = "Retry";

    private final ConfigFacade config;

    public ConfigurationMapper() {
        this(ConfigFacade.getInstance());
    }

    public ConfigurationMapper(final ConfigFacade config) {
        this.config = config;
    }

    /**
     * @return whether the {@code primitive} layer guards {@code name}. Circuit breaker and retry
     * are enabled unless configured otherwise, bulkhead and rate limiter have to be switched on.
     */
    public boolean isEnabled(final String name, final String primitive) {
        final boolean defaultValue = CIRCUIT_BREAKER.equals(primitive) || RETRY.equals(primitive);
        return config.getBoolean(key(name, primitive, "enabled"),
                config.getBoolean(key(primitive, "enabled"), defaultValue));
    }

    public ResilienceDefinition map(final String name) {
        return new ResilienceDefinition(
                isEnabled(name, CIRCUIT_BREAKER) ? mapCircuitBreaker(name) : null,
                isEnabled(name, BULKHEAD) ? mapBulkhead(name) : null,
                isEnabled(name, RATE_LIMITER) ? mapRateLimiter(name) : null,
                isEnabled(name, RETRY) ? mapRetry(name) : null);
    }

    public CircuitBreakerDefinitionImpl mapCircuitBreaker(final String name) {
        final CircuitBreakerBuilderImpl builder = new CircuitBreakerBuilderImpl(name)
                .withMaxRequests(getInt(name, CIRCUIT_BREAKER, "maxRequests", 0))
                .withInterval(getDuration(name, CIRCUIT_BREAKER, "interval", Duration.ZERO))
                .withTimeout(getDuration(name, CIRCUIT_BREAKER, "timeout", Duration.ZERO));
        final int consecutiveFailures = getInt(name, CIRCUIT_BREAKER, "consecutiveFailures", 0);
        if (consecutiveFailures > 0) {
            builder.withConsecutiveFailures(consecutiveFailures);
        }
        final int minRequests = getInt(name, CIRCUIT_BREAKER, "minRequests", 0);
        if (minRequests > 0) {
            builder.withFailureRatio(getDouble(name, CIRCUIT_BREAKER, "failureRatio", 0.5), minRequests);
        }
        return builder.build();
    }

    public BulkheadDefinitionImpl mapBulkhead(final String name) {
        return new BulkheadBuilderImpl(name)
                .withMaxConcurrentExecutions(getInt(name, BULKHEAD, "maxConcurrentExecutions", 0))
                .withMaxWait(getDuration(name, BULKHEAD, "maxWait", Duration.ZERO))
                .build();
    }

    public RateLimiterDefinitionImpl mapRateLimiter(final String name) {
        return new RateLimiterDefinitionImpl(
                getInt(name, RATE_LIMITER, "rate", 0),
                getInt(name, RATE_LIMITER, "burst", 0));
    }

    public RetryDefinitionImpl mapRetry(final String name) {
        final RetryBuilderImpl builder = new RetryBuilderImpl(name);
        final RetryDefinitionImpl defaults = new RetryBuilderImpl(name).build();
        builder.withMaxAttempts(getInt(name, RETRY, "maxAttempts", defaults.getMaxAttempts()))
                .withInitialDelay(getDuration(name, RETRY, "initialDelay", defaults.getInitialDelay()))
                .withMaxDelay(getDuration(name, RETRY, "maxDelay", defaults.getMaxDelay()))
                .withMultiplier(getDouble(name, RETRY, "multiplier", defaults.getMultiplier()))
                .withJitter(getDouble(name, RETRY, "jitter", defaults.getJitter()))
                .withRetryOn(getThrowableClasses(name, RETRY, "retryOn"))
                .withAbortOn(getThrowableClasses(name, RETRY, "abortOn"));
        return builder.build();
    }

    private int getInt(final String name, final String primitive, final String property, final int defaultValue) {
        return config.getInt(key(name, primitive, property), config.getInt(key(primitive, property), defaultValue));
    }

    private long getLong(final String name, final String primitive, final String property, final long defaultValue) {
        return config.getLong(key(name, primitive, property), config.getLong(key(primitive, property), defaultValue));
    }

    private double getDouble(final String name, final String primitive, final String property, final double defaultValue) {
        return config.getDouble(key(name, primitive, property), config.getDouble(key(primitive, property), defaultValue));
    }

    private Duration getDuration(final String name, final String primitive, final String property,
                                 final Duration defaultValue) {
        final long value = getLong(name, primitive, property, -1);
        if (value < 0) {
            return defaultValue;
        }
        final String unitProperty = property + "Unit";
        final ChronoUnit unit = config.getChronoUnit(key(name, primitive, unitProperty),
                config.getChronoUnit(key(primitive, unitProperty), ChronoUnit.MILLIS));
        return unit.getDuration().multipliedBy(value);
    }

    @SuppressWarnings("unchecked")
    private Class<? extends Throwable>[] getThrowableClasses(final String name, final String primitive,
                                                             final String property) {
        return config.getThrowableClasses(key(name, primitive, property),
                config.getThrowableClasses(key(primitive, property), new Class[0]));
    }

    private static String key(final String name, final String primitive, final String property) {
        return String.format("%s/%s/%s", name, primitive, property);
    }

    private static String key(final String primitive, final String property) {
        return String.format("%s/%s", primitive, property);
    }
}
