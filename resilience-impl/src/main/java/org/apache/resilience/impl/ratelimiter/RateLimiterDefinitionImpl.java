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

import org.apache.resilience.api.ratelimiter.RateLimiterDefinition;

public class RateLimiterDefinitionImpl implements RateLimiterDefinition {
    static final int DEFAULT_RATE = 10;

    private final int rate;
    private final int burst;

    /**
     * Non-positive values fall back to 10 tokens per second and a burst equal to the rate.
     */
    public RateLimiterDefinitionImpl(final int rate, final int burst) {
        this.rate = rate <= 0 ? DEFAULT_RATE : rate;
        this.burst = burst <= 0 ? this.rate : burst;
    }

    public RateLimiterDefinitionImpl(final int rate) {
        this(rate, 0);
    }

    @Override
    public int getRate() {
        return rate;
    }

    @Override
    public int getBurst() {
        return burst;
    }

    @Override
    public String toString() {
        return "RateLimiterDefinition{rate=" + rate + ", burst=" + burst + '}';
    }
}
