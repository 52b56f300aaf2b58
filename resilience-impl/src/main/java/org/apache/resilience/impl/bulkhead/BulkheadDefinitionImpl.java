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

package org.apache.resilience.impl.bulkhead;

import java.time.Duration;

import org.apache.resilience.api.bulkhead.BulkheadDefinition;
import org.apache.resilience.api.bulkhead.BulkheadListener;

public class BulkheadDefinitionImpl implements BulkheadDefinition {
    private final String name;
    private final int maxConcurrentExecutions;
    private final Duration maxWait;
    private final BulkheadListener listener;

    BulkheadDefinitionImpl(final String name, final int maxConcurrentExecutions, final Duration maxWait,
                           final BulkheadListener listener) {
        this.name = name;
        this.maxConcurrentExecutions = maxConcurrentExecutions;
        this.maxWait = maxWait;
        this.listener = listener;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getMaxConcurrentExecutions() {
        return maxConcurrentExecutions;
    }

    @Override
    public Duration getMaxWait() {
        return maxWait;
    }

    @Override
    public BulkheadListener getListener() {
        return listener;
    }

    @Override
    public String toString() {
        return "BulkheadDefinition{name='" + name + "', maxConcurrentExecutions=" + maxConcurrentExecutions
                + ", maxWait=" + maxWait + '}';
    }
}
