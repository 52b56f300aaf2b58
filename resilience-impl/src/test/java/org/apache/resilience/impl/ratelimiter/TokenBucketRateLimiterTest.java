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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.resilience.api.CallContext;
import org.apache.resilience.api.ratelimiter.RateLimiter;
import org.apache.resilience.exception.DeadlineExceededException;
import org.testng.annotations.Test;

public class TokenBucketRateLimiterTest {
    @Test
    public void shouldAllowBurstThenRefillOverTime() {
        final AtomicLong now = new AtomicLong();
        final RateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterDefinitionImpl(10, 10), now::get);
        for (int i = 0; i < 10; i++) {
            assertThat(limiter.allow()).as("call %d", i).isTrue();
        }
        assertThat(limiter.allow()).isFalse();

        now.addAndGet(Duration.ofMillis(100).toNanos());
        assertThat(limiter.allow()).isTrue();
        assertThat(limiter.allow()).isFalse();
    }

    @Test
    public void shouldNotAccumulateMoreThanBurst() {
        final AtomicLong now = new AtomicLong();
        final RateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterDefinitionImpl(5, 2), now::get);
        assertThat(limiter.getAvailableTokens()).isEqualTo(2.);

        now.addAndGet(Duration.ofMinutes(1).toNanos());
        assertThat(limiter.getAvailableTokens()).isEqualTo(2.);
        assertThat(limiter.allow()).isTrue();
        assertThat(limiter.allow()).isTrue();
        assertThat(limiter.allow()).isFalse();

        now.addAndGet(Duration.ofMillis(100).toNanos());
        assertThat(limiter.getAvailableTokens()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    public void shouldApplyDefaults() {
        assertThat(new RateLimiterDefinitionImpl(0).getRate()).isEqualTo(10);
        assertThat(new RateLimiterDefinitionImpl(0).getBurst()).isEqualTo(10);
        assertThat(new RateLimiterDefinitionImpl(20, -1).getBurst()).isEqualTo(20);
        assertThat(new RateLimiterDefinitionImpl(20, 3).getBurst()).isEqualTo(3);
    }

    @Test
    public void shouldWaitForNextToken() throws Exception {
        final RateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterDefinitionImpl(50, 1));
        final String first = limiter.execute(CallContext.background(), ctx -> "first");
        assertThat(first).isEqualTo("first");

        final long start = System.nanoTime();
        final String second = limiter.execute(CallContext.background(), ctx -> "second");
        assertThat(second).isEqualTo("second");
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(10));
    }

    @Test
    public void shouldStopWaitingWhenContextEnds() {
        final AtomicLong now = new AtomicLong();
        final RateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterDefinitionImpl(1, 1), now::get);
        assertThat(limiter.allow()).isTrue();

        assertThatThrownBy(() -> limiter.acquire(CallContext.timeout(Duration.ofMillis(50))))
                .isInstanceOf(DeadlineExceededException.class);

        final CallContext cancelled = CallContext.cancellable();
        cancelled.cancel();
        assertThatThrownBy(() -> limiter.execute(cancelled, ctx -> "never"))
                .isInstanceOf(CancellationException.class);
    }
}
