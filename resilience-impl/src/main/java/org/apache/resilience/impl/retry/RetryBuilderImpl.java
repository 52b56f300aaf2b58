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

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.resilience.api.retry.BackoffStrategy;
import org.apache.resilience.api.retry.RetryBuilder;
import org.eclipse.microprofile.faulttolerance.exceptions.FaultToleranceDefinitionException;

/**
 * Defaults: 3 attempts, 1s initial delay doubling on every retry up to 30s, 20% jitter,
 * every error but permanent ones retried.
 */
public class RetryBuilderImpl implements RetryBuilder {
    private final String name;
    private final List<Class<? extends Throwable>> retryOn = new ArrayList<>();
    private final List<Class<? extends Throwable>> abortOn = new ArrayList<>();
    private int maxAttempts = 3;
    private Duration initialDelay = Duration.ofSeconds(1);
    private Duration maxDelay = Duration.ofSeconds(30);
    private double multiplier = 2.;
    private double jitter = .2;
    private BackoffStrategy backoffStrategy;

    public RetryBuilderImpl(final String name) {
        this.name = requireNonNull(name, "name");
    }

    @Override
    public RetryBuilderImpl withMaxAttempts(final int maxAttempts) {
        if (maxAttempts < 1) {
            throw new FaultToleranceDefinitionException("Retry maxAttempts can't be < 1");
        }
        this.maxAttempts = maxAttempts;
        return this;
    }

    @Override
    public RetryBuilderImpl withInitialDelay(final Duration initialDelay) {
        if (initialDelay.isNegative()) {
            throw new FaultToleranceDefinitionException("Retry initial delay can't be < 0");
        }
        this.initialDelay = initialDelay;
        return this;
    }

    @Override
    public RetryBuilderImpl withMaxDelay(final Duration maxDelay) {
        if (maxDelay.isNegative()) {
            throw new FaultToleranceDefinitionException("Retry max delay can't be < 0");
        }
        this.maxDelay = maxDelay;
        return this;
    }

    @Override
    public RetryBuilderImpl withMultiplier(final double multiplier) {
        if (multiplier < 1) {
            throw new FaultToleranceDefinitionException("Retry multiplier can't be < 1");
        }
        this.multiplier = multiplier;
        return this;
    }

    @Override
    public RetryBuilderImpl withJitter(final double jitter) {
        if (jitter < 0 || jitter > 1) {
            throw new FaultToleranceDefinitionException("Retry jitter must be in [0, 1]");
        }
        this.jitter = jitter;
        return this;
    }

    @SafeVarargs
    @Override
    public final RetryBuilderImpl withRetryOn(final Class<? extends Throwable>... retryOn) {
        this.retryOn.addAll(Arrays.asList(retryOn));
        return this;
    }

    @SafeVarargs
    @Override
    public final RetryBuilderImpl withAbortOn(final Class<? extends Throwable>... abortOn) {
        this.abortOn.addAll(Arrays.asList(abortOn));
        return this;
    }

    @Override
    public RetryBuilderImpl withBackoffStrategy(final BackoffStrategy backoffStrategy) {
        this.backoffStrategy = backoffStrategy;
        return this;
    }

    @Override
    public RetryDefinitionImpl build() {
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new FaultToleranceDefinitionException(
                    "Retry max delay " + maxDelay + " can't be < initial delay " + initialDelay);
        }
        return new RetryDefinitionImpl(name, maxAttempts, initialDelay, maxDelay, multiplier, jitter,
                retryOn, abortOn, backoffStrategy);
    }
}
