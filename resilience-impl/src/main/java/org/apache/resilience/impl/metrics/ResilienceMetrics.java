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
package org.apache.resilience.impl.metrics;

import static java.util.Comparator.comparing;
import static java.util.Optional.ofNullable;

import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Supplier;
import java.util.stream.StreamSupport;

import javax.annotation.Priority;

/**
 * Named counters and gauges kept by the primitives. Values are only read back through
 * accessors, nothing is exported.
 */
public interface ResilienceMetrics {
    Counter counter(String name, String description);
    void gauge(String name, String description, String unit, Supplier<Long> supplier);

    interface Counter {
        void inc();
        long getCount();
    }

    static ResilienceMetrics create() {
        final Optional<ResilienceMetrics> provided = StreamSupport.stream(
                ServiceLoader.load(ResilienceMetrics.class).spliterator(), false)
                .min(comparing(it -> ofNullable(it.getClass().getAnnotation(Priority.class)).map(Priority::value).orElse(0)));
        return provided.orElseGet(InMemoryResilienceMetrics::new);
    }

    static ResilienceMetrics noop() {
        return NoMetrics.INSTANCE;
    }

    final class NoMetrics implements ResilienceMetrics {
        private static final NoMetrics INSTANCE = new NoMetrics();

        private NoMetrics() {
            // singleton
        }

        @Override
        public Counter counter(final String name, final String description) {
            return new Counter() {
                @Override
                public void inc() {
                    // no-op
                }

                @Override
                public long getCount() {
                    return 0;
                }
            };
        }

        @Override
        public void gauge(final String name, final String description, final String unit, final Supplier<Long> supplier) {
            // no-op
        }
    }
}
