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

package org.apache.resilience.impl.retry.backoff;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import org.apache.resilience.api.retry.BackoffStrategy;

/**
 * Each delay is drawn uniformly from {@code [baseDelay, 3 * previousDelay]} and capped at
 * {@code maxDelay}. The first attempt, and the first one after {@link #reset()}, waits
 * {@code baseDelay}.
 */
public class DecorrelatedJitterBackoff implements BackoffStrategy {
    private final long baseDelay;
    private final long maxDelay;
    private long lastDelay;

    public DecorrelatedJitterBackoff(final Duration baseDelay, final Duration maxDelay) {
        Backoffs.validate(baseDelay, maxDelay);
        this.baseDelay = baseDelay.toNanos();
        this.maxDelay = maxDelay.toNanos();
        this.lastDelay = this.baseDelay;
    }

    @Override
    public synchronized Duration nextDelay(final int attempt) {
        if (attempt == 0) {
            lastDelay = baseDelay;
            return Duration.ofNanos(baseDelay);
        }
        final double upper = lastDelay * 3.;
        final double delay = baseDelay + ThreadLocalRandom.current().nextDouble() * (upper - baseDelay);
        lastDelay = delay >= maxDelay ? maxDelay : (long) delay;
        return Duration.ofNanos(lastDelay);
    }

    @Override
    public synchronized void reset() {
        lastDelay = baseDelay;
    }

    @Override
    public String toString() {
        return "DecorrelatedJitterBackoff{baseDelay=" + Duration.ofNanos(baseDelay)
                + ", maxDelay=" + Duration.ofNanos(maxDelay) + '}';
    }
}
