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
import java.util.function.Predicate;

public interface CircuitBreakerDefinition {
    String getName();

    /**
     * @return how many probe calls a half-open breaker admits, and how many consecutive
     * probe successes close it again.
     */
    int getMaxRequests();

    /**
     * @return the length of the closed-state measurement window.
     */
    Duration getInterval();

    /**
     * @return how long the breaker stays open before probing.
     */
    Duration getTimeout();

    Predicate<Counts> getReadyToTrip();

    /**
     * @return the predicate deciding whether an outcome counts as a success; it receives
     * {@code null} for a normal return and the thrown exception otherwise.
     */
    Predicate<Throwable> getIsSuccessful();

    StateChangeListener getStateChangeListener();
}
