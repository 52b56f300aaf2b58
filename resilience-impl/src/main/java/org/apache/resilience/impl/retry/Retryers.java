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

import org.apache.resilience.api.CallContext;
import org.apache.resilience.api.ContextualCallable;
import org.apache.resilience.api.retry.BackoffStrategy;

/**
 * One-off retries without a shared {@link org.apache.resilience.api.retry.Retryer}.
 */
public final class Retryers {
    private Retryers() {
        // no-op
    }

    public static <T> T retry(final CallContext context, final ContextualCallable<T> callable) throws Exception {
        return new DefaultRetryer(new RetryBuilderImpl("retry").build()).call(context, callable);
    }

    public static <T> T retryN(final CallContext context, final int attempts,
                               final ContextualCallable<T> callable) throws Exception {
        return new DefaultRetryer(new RetryBuilderImpl("retry-" + attempts)
                .withMaxAttempts(attempts)
                .build()).call(context, callable);
    }

    /**
     * Retries every error but permanent ones, waiting as {@code strategy} says between attempts.
     */
    public static <T> T retryWithBackoff(final CallContext context, final BackoffStrategy strategy,
                                         final int maxAttempts, final ContextualCallable<T> callable) throws Exception {
        return new DefaultRetryer(new RetryBuilderImpl("retry-with-backoff")
                .withMaxAttempts(maxAttempts)
                .withBackoffStrategy(strategy)
                .build()).call(context, callable);
    }
}
