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

import static java.util.Collections.unmodifiableList;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.resilience.api.retry.BackoffStrategy;
import org.apache.resilience.api.retry.RetryDefinition;

public class RetryDefinitionImpl implements RetryDefinition {
    private final String name;
    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final double jitter;
    private final List<Class<? extends Throwable>> retryOn;
    private final List<Class<? extends Throwable>> abortOn;
    private final BackoffStrategy backoffStrategy;

    RetryDefinitionImpl(final String name, final int maxAttempts, final Duration initialDelay,
                        final Duration maxDelay, final double multiplier, final double jitter,
                        final List<Class<? extends Throwable>> retryOn,
                        final List<Class<? extends Throwable>> abortOn,
                        final BackoffStrategy backoffStrategy) {
        this.name = name;
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.jitter = jitter;
        this.retryOn = unmodifiableList(new ArrayList<>(retryOn));
        this.abortOn = unmodifiableList(new ArrayList<>(abortOn));
        this.backoffStrategy = backoffStrategy;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public Duration getInitialDelay() {
        return initialDelay;
    }

    @Override
    public Duration getMaxDelay() {
        return maxDelay;
    }

    @Override
    public double getMultiplier() {
        return multiplier;
    }

    @Override
    public double getJitter() {
        return jitter;
    }

    @Override
    public List<Class<? extends Throwable>> getRetryOn() {
        return retryOn;
    }

    @Override
    public List<Class<? extends Throwable>> getAbortOn() {
        return abortOn;
    }

    @Override
    public Optional<BackoffStrategy> getBackoffStrategy() {
        return Optional.ofNullable(backoffStrategy);
    }

    @Override
    public String toString() {
        return "RetryDefinition{name='" + name + "', maxAttempts=" + maxAttempts + ", initialDelay=" + initialDelay
                + ", maxDelay=" + maxDelay + ", multiplier=" + multiplier + ", jitter=" + jitter
                + ", retryOn=" + retryOn + ", abortOn=" + abortOn + ", backoffStrategy=" + backoffStrategy + '}';
    }
}
