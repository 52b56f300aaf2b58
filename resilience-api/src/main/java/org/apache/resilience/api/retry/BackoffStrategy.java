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

package org.apache.resilience.api.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import org.eclipse.microprofile.faulttolerance.exceptions.FaultToleranceDefinitionException;

/**
 * Computes the delay before a retry. {@code attempt} is zero based: the delay preceding the
 * second call is {@code nextDelay(0)}.
 */
public interface BackoffStrategy {
    Duration nextDelay(int attempt);

    /**
     * Forgets any state accumulated across calls. Invoked after a successful attempt.
     */
    default void reset() {
        // stateless by default
    }

    /**
     * @return a strategy spreading every delay of this one uniformly over
     * {@code [delay * (1 - fraction), delay * (1 + fraction)]}.
     */
    default BackoffStrategy withJitter(final double fraction) {
        if (fraction < 0 || fraction > 1) {
            throw new FaultToleranceDefinitionException("jitter must be in [0, 1]: " + fraction);
        }
        if (fraction == 0) {
            return this;
        }
        final BackoffStrategy delegate = this;
        return new BackoffStrategy() {
            @Override
            public Duration nextDelay(final int attempt) {
                final long nanos = delegate.nextDelay(attempt).toNanos();
                final double factor = 1 + fraction * (2 * ThreadLocalRandom.current().nextDouble() - 1);
                return Duration.ofNanos(Math.max(0, (long) (nanos * factor)));
            }

            @Override
            public void reset() {
                delegate.reset();
            }

            @Override
            public String toString() {
                return delegate + " with jitter " + fraction;
            }
        };
    }
}
