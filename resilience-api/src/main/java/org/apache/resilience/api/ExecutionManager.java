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

package org.apache.resilience.api;

import java.util.concurrent.Callable;

import org.apache.resilience.api.bulkhead.BulkheadManager;
import org.apache.resilience.api.circuitbreaker.CircuitBreakerManager;

public interface ExecutionManager extends AutoCloseable {
    CircuitBreakerManager getCircuitBreakerManager();

    BulkheadManager getBulkheadManager();

    /**
     * @return the decorator guarding the dependency {@code name}, created from configuration
     * on first use and shared afterwards.
     */
    ResilienceDecorator getDecorator(String name);

    <T> T execute(String name, Callable<T> callable) throws Exception;

    @Override
    void close();
}
