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

import java.time.Duration;
import java.util.function.Predicate;

import org.apache.resilience.api.circuitbreaker.CircuitBreakerDefinition;
import org.apache.resilience.api.circuitbreaker.Counts;
import org.apache.resilience.api.circuitbreaker.StateChangeListener;

public class CircuitBreakerDefinitionImpl implements CircuitBreakerDefinition {
    private final String name;
    private final int maxRequests;
    private final Duration interval;
    private final Duration timeout;
    private final Predicate<Counts> readyToTrip;
    private final Predicate<Throwable> isSuccessful;
    private final StateChangeListener stateChangeListener;

    CircuitBreakerDefinitionImpl(final String name, final int maxRequests, final Duration interval,
                                 final Duration timeout, final Predicate<Counts> readyToTrip,
                                 final Predicate<Throwable> isSuccessful,
                                 final StateChangeListener stateChangeListener) {
        this.name = name;
        this.maxRequests = maxRequests;
        this.interval = interval;
        this.timeout = timeout;
        this.readyToTrip = readyToTrip;
        this.isSuccessful = isSuccessful;
        this.stateChangeListener = stateChangeListener;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getMaxRequests() {
        return maxRequests;
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public Predicate<Counts> getReadyToTrip() {
        return readyToTrip;
    }

    @Override
    public Predicate<Throwable> getIsSuccessful() {
        return isSuccessful;
    }

    @Override
    public StateChangeListener getStateChangeListener() {
        return stateChangeListener;
    }

    @Override
    public String toString() {
        return "CircuitBreakerDefinition{name='" + name + "', maxRequests=" + maxRequests
                + ", interval=" + interval + ", timeout=" + timeout + '}';
    }
}
