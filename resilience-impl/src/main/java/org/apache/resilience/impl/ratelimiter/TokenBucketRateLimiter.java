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

package org.apache.resilience.impl.ratelimiter;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

import org.apache.resilience.api.CallContext;
import org.apache.resilience.api.ContextualCallable;
import org.apache.resilience.api.ratelimiter.RateLimiter;
import org.apache.resilience.api.ratelimiter.RateLimiterDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token bucket refilled lazily from the elapsed time on every access. The bucket starts full.
 */
public class TokenBucketRateLimiter implements RateLimiter {
    private static final Logger LOGGER = LoggerFactory.getLogger(TokenBucketRateLimiter.class);
    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final RateLimiterDefinition definition;
    private final int rate;
    private final int burst;
    private final Duration pollInterval;
    private final LongSupplier clock;
    private final Lock lock = new ReentrantLock();

    // guarded by lock
    private double tokens;
    private long lastUpdate;

    public TokenBucketRateLimiter(final RateLimiterDefinition definition) {
        this(definition, System::nanoTime);
    }

    TokenBucketRateLimiter(final RateLimiterDefinition definition, final LongSupplier clock) {
        this.definition = definition;
        this.rate = definition.getRate();
        this.burst = definition.getBurst();
        this.pollInterval = Duration.ofNanos((long) (NANOS_PER_SECOND / rate));
        this.clock = clock;
        this.tokens = burst;
        this.lastUpdate = clock.getAsLong();
    }

    @Override
    public RateLimiterDefinition getDefinition() {
        return definition;
    }

    @Override
    public boolean allow() {
        lock.lock();
        try {
            refill();
            if (tokens >= 1) {
                tokens--;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void acquire(final CallContext context) throws InterruptedException {
        while (!allow()) {
            LOGGER.debug("No token available, waiting {}", pollInterval);
            context.sleep(pollInterval);
        }
    }

    @Override
    public <T> T execute(final CallContext context, final ContextualCallable<T> callable) throws Exception {
        acquire(context);
        return callable.call(context);
    }

    @Override
    public double getAvailableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        final long now = clock.getAsLong();
        final long elapsed = now - lastUpdate;
        lastUpdate = now;
        if (elapsed > 0) {
            tokens = Math.min(burst, tokens + rate * (elapsed / NANOS_PER_SECOND));
        }
    }

    @Override
    public String toString() {
        return "TokenBucketRateLimiter{rate=" + rate + ", burst=" + burst + '}';
    }
}
