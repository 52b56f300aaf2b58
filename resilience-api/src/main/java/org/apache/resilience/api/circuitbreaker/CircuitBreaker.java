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

package org.apache.resilience.api.circuitbreaker;

import java.time.Duration;
import java.util.concurrent.Callable;

import org.apache.resilience.api.CallContext;
import org.apache.resilience.api.ContextualCallable;

/**
 * Closed/open/half-open state machine guarding calls to one dependency.
 *
 * <p>State is evaluated lazily on every call, there is no background timer. Rejections are
 * thrown as {@link org.apache.resilience.exception.CircuitOpenException} (open) and
 * {@link org.apache.resilience.exception.TooManyRequestsException} (half-open probes
 * exhausted) without invoking the operation.</p>
 */
public interface CircuitBreaker {
    String getName();

    CircuitBreakerDefinition getDefinition();

    CircuitBreakerState getState();

    Counts getCounts();

    /**
     * Runs {@code callable} on the calling thread. An {@link Error} escaping it is counted as
     * a failure and re-thrown unchanged.
     */
    <T> T execute(Callable<T> callable) throws Exception;

    /**
     * Runs {@code callable} on a separate thread and races its completion against
     * {@code context}. When the context wins, the call is recorded as a failure, the
     * worker is interrupted and the context's error is thrown; the operation is only
     * stopped if it honors interruption or its context.
     */
    <T> T executeWithContext(CallContext context, ContextualCallable<T> callable) throws Exception;

    /**
     * Same as {@link #executeWithContext(CallContext, ContextualCallable)} under a fresh
     * deadline, the expiry of which is reported as a
     * {@link org.apache.resilience.exception.CircuitTimeoutException}.
     */
    <T> T executeWithTimeout(Duration timeout, ContextualCallable<T> callable) throws Exception;

    /**
     * Forces the breaker back to closed with fresh counts.
     */
    void reset();

    void transitionState(CircuitBreakerState state);
}
