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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.resilience.api.CallContext;
import org.apache.resilience.exception.PermanentException;
import org.apache.resilience.exception.RetryException;
import org.apache.resilience.impl.retry.backoff.ConstantBackoff;
import org.testng.annotations.Test;

public class RetryersTest {
    @Test
    public void retryWithBackoff() throws Exception {
        final AtomicInteger calls = new AtomicInteger();
        final int result = Retryers.retryWithBackoff(CallContext.background(), new ConstantBackoff(Duration.ofMillis(1)), 4,
                ctx -> {
                    if (calls.incrementAndGet() < 3) {
                        throw new IllegalStateException("not yet");
                    }
                    return calls.get();
                });
        assertThat(result).isEqualTo(3);
    }

    @Test
    public void retryWithBackoffExhausted() {
        assertThatThrownBy(() -> Retryers.retryWithBackoff(CallContext.background(), new ConstantBackoff(Duration.ZERO), 2,
                ctx -> {
                    throw new IllegalStateException("never");
                })).isInstanceOfSatisfying(RetryException.class, e -> assertThat(e.getErrors()).hasSize(2));
    }

    @Test
    public void retryNStopsOnPermanentError() {
        final AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> Retryers.retryN(CallContext.background(), 10, ctx -> {
            calls.incrementAndGet();
            throw PermanentException.markPermanent(new IllegalArgumentException("invalid"));
        })).isInstanceOf(RetryException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    public void retryReturnsContextError() {
        final CallContext context = CallContext.cancellable();
        context.cancel();
        assertThatThrownBy(() -> Retryers.retry(context, ctx -> {
            throw new IllegalStateException("down");
        })).isInstanceOf(CancellationException.class);
    }
}
