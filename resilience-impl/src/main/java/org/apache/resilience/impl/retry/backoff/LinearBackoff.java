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

import org.apache.resilience.api.retry.BackoffStrategy;

/**
 * {@code initialDelay + attempt * increment}, capped at {@code maxDelay}.
 */
public class LinearBackoff implements BackoffStrategy {
    private final Duration initialDelay;
    private final Duration increment;
    private final Duration maxDelay;

    public LinearBackoff(final Duration initialDelay, final Duration increment, final Duration maxDelay) {
        Backoffs.validate(initialDelay, maxDelay);
        Backoffs.validate(increment);
        this.initialDelay = initialDelay;
        this.increment = increment;
        this.maxDelay = maxDelay;
    }

    @Override
    public Duration nextDelay(final int attempt) {
        final long delay = initialDelay.toNanos() + attempt * increment.toNanos();
        final long max = maxDelay.toNanos();
        return Duration.ofNanos(delay > max || delay < 0 ? max : delay);
    }

    @Override
    public String toString() {
        return "LinearBackoff{initialDelay=" + initialDelay + ", increment=" + increment + ", maxDelay=" + maxDelay + '}';
    }
}
