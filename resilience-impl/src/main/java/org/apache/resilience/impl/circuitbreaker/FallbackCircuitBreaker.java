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

package org.apache.resilience.impl.circuitbreaker;

import java.util.concurrent.Callable;

import org.apache.resilience.api.circuitbreaker.CircuitBreaker;
import org.apache.resilience.exception.CircuitOpenException;
import org.apache.resilience.exception.TooManyRequestsException;
import org.eclipse.microprofile.faulttolerance.exceptions.FaultToleranceException;

/**
 * Routes calls rejected by a breaker to a fallback. Failures of the operation itself are
 * propagated unchanged, including rejections raised by other breakers it calls.
 */
public class FallbackCircuitBreaker {
    private final CircuitBreaker delegate;

    public FallbackCircuitBreaker(final CircuitBreaker delegate) {
        this.delegate = delegate;
    }

    public <T> T executeWithFallback(final Callable<T> callable, final Fallback<T> fallback) throws Exception {
        try {
            return delegate.execute(callable);
        } catch (final CircuitOpenException | TooManyRequestsException rejected) {
            if (!isRejectedBy(rejected, delegate.getName())) {
                throw rejected;
            }
            return fallback.apply(rejected);
        }
    }

    /**
     * @return whether {@code rejected} was raised by the breaker named {@code breakerName}
     * and not by a breaker nested in the guarded operation.
     */
    static boolean isRejectedBy(final FaultToleranceException rejected, final String breakerName) {
        if (rejected instanceof CircuitOpenException) {
            return breakerName.equals(((CircuitOpenException) rejected).getCircuitBreakerName());
        }
        if (rejected instanceof TooManyRequestsException) {
            return breakerName.equals(((TooManyRequestsException) rejected).getCircuitBreakerName());
        }
        return false;
    }

    public CircuitBreaker getDelegate() {
        return delegate;
    }

    @FunctionalInterface
    public interface Fallback<T> {
        T apply(FaultToleranceException rejection) throws Exception;
    }
}
