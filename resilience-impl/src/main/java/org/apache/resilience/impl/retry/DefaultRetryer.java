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

package org.apache.resilience.impl.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.apache.resilience.api.CallContext;
import org.apache.resilience.api.ContextualCallable;
import org.apache.resilience.api.ContextualRunnable;
import org.apache.resilience.api.retry.BackoffStrategy;
import org.apache.resilience.api.retry.RetryDefinition;
import org.apache.resilience.api.retry.Retryer;
import org.apache.resilience.exception.PermanentException;
import org.apache.resilience.exception.RetryException;
import org.apache.resilience.impl.metrics.ResilienceMetrics;
import org.apache.resilience.impl.retry.backoff.ExponentialBackoff;
import org.apache.resilience.impl.util.Exceptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DefaultRetryer implements Retryer {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRetryer.class);

    private final RetryDefinition definition;
    private final BackoffStrategy backoff;
    private final Sleeper sleeper;

    private final ResilienceMetrics.Counter callsSucceededNotRetried;
    private final ResilienceMetrics.Counter callsSucceededRetried;
    private final ResilienceMetrics.Counter callsFailed;
    private final ResilienceMetrics.Counter retries;

    public DefaultRetryer(final RetryDefinition definition) {
        this(definition, ResilienceMetrics.noop());
    }

    public DefaultRetryer(final RetryDefinition definition, final ResilienceMetrics metrics) {
        this(definition, metrics, CallContext::sleep);
    }

    DefaultRetryer(final RetryDefinition definition, final ResilienceMetrics metrics, final Sleeper sleeper) {
        this.definition = definition;
        this.sleeper = sleeper;
        this.backoff = definition.getBackoffStrategy().orElseGet(() ->
                new ExponentialBackoff(definition.getInitialDelay(), definition.getMaxDelay(), definition.getMultiplier())
                        .withJitter(definition.getJitter()));

        final String metricsNameBase = "resilience.retry." + definition.getName() + ".";
        this.callsSucceededNotRetried = metrics.counter(metricsNameBase + "callsSucceededNotRetried.total",
                "Number of calls that succeeded at the first attempt");
        this.callsSucceededRetried = metrics.counter(metricsNameBase + "callsSucceededRetried.total",
                "Number of calls that succeeded after at least one retry");
        this.callsFailed = metrics.counter(metricsNameBase + "callsFailed.total",
                "Number of calls that failed after retries or with a non retryable error");
        this.retries = metrics.counter(metricsNameBase + "retries.total", "Number of retries");
    }

    @Override
    public RetryDefinition getDefinition() {
        return definition;
    }

    @Override
    public void run(final CallContext context, final ContextualRunnable runnable) throws Exception {
        call(context, runnable.asCallable());
    }

    @Override
    public <T> T call(final CallContext context, final ContextualCallable<T> callable) throws Exception {
        final int maxAttempts = definition.getMaxAttempts();
        final List<Throwable> errors = new ArrayList<>();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                context.throwIfDone();
            }
            try {
                final T result = callable.call(context);
                backoff.reset();
                (attempt == 0 ? callsSucceededNotRetried : callsSucceededRetried).inc();
                return result;
            } catch (final Exception e) {
                errors.add(e);
                if (!shouldRetry(e)) {
                    throw fail(errors);
                }
                if (attempt == maxAttempts - 1) {
                    break;
                }
                final Duration delay = backoff.nextDelay(attempt);
                LOGGER.debug("Retry '{}' attempt {}/{} failed ({}), next attempt in {}",
                        definition.getName(), attempt + 1, maxAttempts, e.getMessage(), delay);
                retries.inc();
                sleeper.sleep(context, delay);
            }
        }
        throw fail(errors);
    }

    boolean shouldRetry(final Throwable error) {
        if (PermanentException.isPermanent(error)) {
            return false;
        }
        if (Exceptions.isCausedBy(error, definition.getAbortOn())) {
            return false;
        }
        if (!definition.getRetryOn().isEmpty()) {
            return Exceptions.isCausedBy(error, definition.getRetryOn());
        }
        return true;
    }

    private RetryException fail(final List<Throwable> errors) {
        callsFailed.inc();
        final RetryException failure = new RetryException(errors.size(), errors);
        LOGGER.warn("Retry '{}' gave up: {}", definition.getName(), failure.getMessage());
        return failure;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(CallContext context, Duration delay) throws InterruptedException;
    }
}
