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

package org.apache.resilience.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;

import org.eclipse.microprofile.faulttolerance.exceptions.BulkheadException;
import org.eclipse.microprofile.faulttolerance.exceptions.CircuitBreakerOpenException;
import org.testng.annotations.Test;

public class ExceptionsTest {
    @Test
    public void permanentMarkerIsFoundThroughCauses() {
        final PermanentException permanent = PermanentException.markPermanent(new IOException("bad input"));
        assertThat(PermanentException.markPermanent(permanent)).isSameAs(permanent);
        assertThat(PermanentException.isPermanent(permanent)).isTrue();
        assertThat(PermanentException.isPermanent(new IllegalStateException(permanent))).isTrue();
        assertThat(PermanentException.isPermanent(new IOException())).isFalse();
        assertThat(PermanentException.isPermanent(null)).isFalse();
    }

    @Test
    public void retryExceptionKeepsEveryAttempt() {
        final IOException first = new IOException("first");
        final IOException last = new IOException("last");
        final RetryException exception = new RetryException(2, Arrays.asList(first, last));
        assertThat(exception.getAttempts()).isEqualTo(2);
        assertThat(exception.getErrors()).containsExactly(first, last);
        assertThat(exception.getLastError()).isSameAs(last);
        assertThat(exception).hasMessageContaining("2 attempts").hasCause(last);

        assertThat(new RetryException(0, Collections.emptyList()).getLastError()).isNull();
    }

    @Test
    public void rejectionsMapToFaultToleranceHierarchy() {
        assertThat(new CircuitOpenException("db")).isInstanceOf(CircuitBreakerOpenException.class).hasMessageContaining("db");
        assertThat(new TooManyRequestsException("busy")).isInstanceOf(BulkheadException.class);
        assertThat(new TooManyRequestsException("busy").getCircuitBreakerName()).isNull();
        assertThat(new TooManyRequestsException("busy", "db").getCircuitBreakerName()).isEqualTo("db");
        assertThat(new CircuitOpenException("db").getCircuitBreakerName()).isEqualTo("db");
        assertThat(new BulkheadFullException("pool")).isInstanceOf(BulkheadException.class).hasMessageContaining("pool");
        assertThat(new BulkheadTimeoutException("pool", Duration.ofMillis(5))).isInstanceOf(BulkheadException.class);
    }
}
