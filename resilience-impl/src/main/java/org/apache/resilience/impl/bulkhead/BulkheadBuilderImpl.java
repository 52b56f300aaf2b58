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

import static java.util.Objects.requireNonNull;

import java.time.Duration;

import org.apache.resilience.api.bulkhead.BulkheadBuilder;
import org.apache.resilience.api.bulkhead.BulkheadDefinition;
import org.apache.resilience.api.bulkhead.BulkheadListener;
import org.eclipse.microprofile.faulttolerance.exceptions.FaultToleranceDefinitionException;

/**
 * Defaults to 10 concurrent executions without waiting; a zero capacity also means 10.
 */
public class BulkheadBuilderImpl implements BulkheadBuilder {
    static final int DEFAULT_MAX_CONCURRENT_EXECUTIONS = 10;

    private final String name;
    private final BulkheadManagerImpl manager;
    private int maxConcurrentExecutions;
    private Duration maxWait = Duration.ZERO;
    private BulkheadListener listener = BulkheadListener.NONE;

    public BulkheadBuilderImpl(final String name) {
        this(name, null);
    }

    BulkheadBuilderImpl(final String name, final BulkheadManagerImpl manager) {
        this.name = requireNonNull(name, "name");
        this.manager = manager;
    }

    public static BulkheadBuilderImpl from(final String name, final BulkheadDefinition template) {
        return new BulkheadBuilderImpl(name)
                .withMaxConcurrentExecutions(template.getMaxConcurrentExecutions())
                .withMaxWait(template.getMaxWait())
                .withListener(template.getListener());
    }

    @Override
    public BulkheadBuilderImpl withMaxConcurrentExecutions(final int maxConcurrentExecutions) {
        if (maxConcurrentExecutions < 0) {
            throw new FaultToleranceDefinitionException("Bulkhead max concurrent executions can't be < 0");
        }
        this.maxConcurrentExecutions = maxConcurrentExecutions;
        return this;
    }

    @Override
    public BulkheadBuilderImpl withMaxWait(final Duration maxWait) {
        if (maxWait.isNegative()) {
            throw new FaultToleranceDefinitionException("Bulkhead max wait can't be < 0");
        }
        this.maxWait = maxWait;
        return this;
    }

    @Override
    public BulkheadBuilderImpl withListener(final BulkheadListener listener) {
        this.listener = requireNonNull(listener, "listener");
        return this;
    }

    @Override
    public BulkheadDefinitionImpl build() {
        final BulkheadDefinitionImpl definition = new BulkheadDefinitionImpl(name,
                maxConcurrentExecutions == 0 ? DEFAULT_MAX_CONCURRENT_EXECUTIONS : maxConcurrentExecutions,
                maxWait, listener);
        if (manager != null) {
            manager.register(name, definition);
        }
        return definition;
    }
}
