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

package org.apache.resilience.impl.cdi;

import javax.enterprise.context.ApplicationScoped;
import javax.enterprise.inject.Disposes;
import javax.enterprise.inject.Produces;

import org.apache.resilience.api.ExecutionManager;
import org.apache.resilience.api.bulkhead.BulkheadManager;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerManager;
import org.apache.resilience.impl.DefaultExecutionManager;

/**
 * Makes one {@link ExecutionManager} and its registries injectable for the whole application.
 */
@ApplicationScoped
public class ResilienceProducer {
    @Produces
    @ApplicationScoped
    public ExecutionManager executionManager() {
        return new DefaultExecutionManager();
    }

    @Produces
    public CircuitBreakerManager circuitBreakerManager(final ExecutionManager executionManager) {
        return executionManager.getCircuitBreakerManager();
    }

    @Produces
    public BulkheadManager bulkheadManager(final ExecutionManager executionManager) {
        return executionManager.getBulkheadManager();
    }

    public void close(@Disposes final ExecutionManager executionManager) {
        executionManager.close();
    }
}
