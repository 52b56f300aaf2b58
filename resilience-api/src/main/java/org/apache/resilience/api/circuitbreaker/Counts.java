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

/**
 * Request counts of the current circuit breaker generation. Every generation change
 * starts again from {@link #EMPTY}.
 */
public final class Counts {
    public static final Counts EMPTY = new Counts(0, 0, 0, 0, 0);

    private final int requests;
    private final int totalSuccesses;
    private final int totalFailures;
    private final int consecutiveSuccesses;
    private final int consecutiveFailures;

    public Counts(final int requests, final int totalSuccesses, final int totalFailures,
                  final int consecutiveSuccesses, final int consecutiveFailures) {
        this.requests = requests;
        this.totalSuccesses = totalSuccesses;
        this.totalFailures = totalFailures;
        this.consecutiveSuccesses = consecutiveSuccesses;
        this.consecutiveFailures = consecutiveFailures;
    }

    public int getRequests() {
        return requests;
    }

    public int getTotalSuccesses() {
        return totalSuccesses;
    }

    public int getTotalFailures() {
        return totalFailures;
    }

    public int getConsecutiveSuccesses() {
        return consecutiveSuccesses;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * @return {@code totalFailures / requests}, {@code 0} before the first request.
     */
    public double getFailureRatio() {
        if (requests == 0) {
            return 0;
        }
        return (double) totalFailures / requests;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Counts counts = Counts.class.cast(o);
        return requests == counts.requests && totalSuccesses == counts.totalSuccesses
                && totalFailures == counts.totalFailures
                && consecutiveSuccesses == counts.consecutiveSuccesses
                && consecutiveFailures == counts.consecutiveFailures;
    }

    @Override
    public int hashCode() {
        int result = requests;
        result = 31 * result + totalSuccesses;
        result = 31 * result + totalFailures;
        result = 31 * result + consecutiveSuccesses;
        result = 31 * result + consecutiveFailures;
        return result;
    }

    @Override
    public String toString() {
        return "Counts{requests=" + requests + ", totalSuccesses=" + totalSuccesses
                + ", totalFailures=" + totalFailures + ", consecutiveSuccesses=" + consecutiveSuccesses
                + ", consecutiveFailures=" + consecutiveFailures + '}';
    }
}
