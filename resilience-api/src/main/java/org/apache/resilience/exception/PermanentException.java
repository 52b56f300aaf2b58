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

/**
 * Marks an error as non-retryable whatever the retry lists say, typically a client
 * error rather than a transient fault.
 */
public class PermanentException extends RuntimeException {
    private PermanentException(final Throwable cause) {
        super("permanent error: " + cause, cause);
    }

    public static PermanentException markPermanent(final Throwable error) {
        if (error instanceof PermanentException) {
            return (PermanentException) error;
        }
        return new PermanentException(error);
    }

    public static boolean isPermanent(final Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof PermanentException) {
                return true;
            }
        }
        return false;
    }
}
