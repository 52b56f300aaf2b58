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

import org.apache.resilience.api.CallContext;
import org.apache.resilience.api.ContextualCallable;
import org.apache.resilience.api.ContextualRunnable;

/**
 * Calls an operation until it succeeds, fails with a non retryable error or runs out of
 * attempts. Terminal failures surface as
 * {@link org.apache.resilience.exception.RetryException}; a context done before an attempt
 * or during a delay surfaces as the context's own error.
 */
public interface Retryer {
    RetryDefinition getDefinition();

    void run(CallContext context, ContextualRunnable runnable) throws Exception;

    <T> T call(CallContext context, ContextualCallable<T> callable) throws Exception;
}
