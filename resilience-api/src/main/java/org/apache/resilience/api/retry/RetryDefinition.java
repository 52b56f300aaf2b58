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
import java.util.List;
import java.util.Optional;

public interface RetryDefinition {
    String getName();

    int getMaxAttempts();

    Duration getInitialDelay();

    Duration getMaxDelay();

    double getMultiplier();

    double getJitter();

    List<Class<? extends Throwable>> getRetryOn();

    /**
     * @return exception types never retried; checked before {@link #getRetryOn()}.
     */
    List<Class<? extends Throwable>> getAbortOn();

    /**
     * @return the strategy replacing the exponential backoff derived from the delays,
     * the multiplier and the jitter of this definition.
     */
    Optional<BackoffStrategy> getBackoffStrategy();
}
