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

package org.apache.resilience.api.bulkhead;

import java.util.concurrent.Callable;

import org.apache.resilience.api.CallContext;
import org.apache.resilience.api.ContextualCallable;

/**
 * Bounds the number of concurrent executions against one dependency. The slot taken by a
 * call is released however the call exits.
 */
public interface Bulkhead {
    String getName();

    BulkheadDefinition getDefinition();

    <T> T execute(Callable<T> callable) throws Exception;

    /**
     * Like {@link #execute(Callable)}, except that waiting for a slot gives up as soon as
     * {@code context} is done, throwing the context's error.
     */
    <T> T executeWithContext(CallContext context, ContextualCallable<T> callable) throws Exception;

    int getActiveCount();

    int getWaitingCount();

    int getAvailableSlots();
}
