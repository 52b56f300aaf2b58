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

package org.apache.resilience.exception;

import static java.util.Collections.unmodifiableList;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.microprofile.faulttolerance.exceptions.FaultToleranceException;

/**
 * Terminal failure of a retried call. The cause is the error of the last attempt,
 * {@link #getErrors()} holds the error of every attempt in order.
 */
public class RetryException extends FaultToleranceException {
    private final int attempts;
    private final List<Throwable> errors;

    public RetryException(final int attempts, final List<? extends Throwable> errors) {
        super("failed after " + attempts + " attempts: " + last(errors), last(errors));
        this.attempts = attempts;
        this.errors = unmodifiableList(new ArrayList<>(errors));
    }

    public int getAttempts() {
        return attempts;
    }

    public Throwable getLastError() {
        return getCause();
    }

    public List<Throwable> getErrors() {
        return errors;
    }

    private static Throwable last(final List<? extends Throwable> errors) {
        return errors.isEmpty() ? null : errors.get(errors.size() - 1);
    }
}
