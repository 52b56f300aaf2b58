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

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

public class InMemoryResilienceMetrics implements ResilienceMetrics {
    private final ConcurrentMap<String, CounterImpl> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Supplier<Long>> gauges = new ConcurrentHashMap<>();

    @Override
    public Counter counter(final String name, final String description) {
        return counters.computeIfAbsent(name, k -> new CounterImpl());
    }

    @Override
    public void gauge(final String name, final String description, final String unit, final Supplier<Long> supplier) {
        gauges.put(name, supplier);
    }

    /**
     * @return the current value of every counter and gauge, sorted by name.
     */
    public Map<String, Long> snapshot() {
        final Map<String, Long> values = new TreeMap<>();
        counters.forEach((name, counter) -> values.put(name, counter.getCount()));
        gauges.forEach((name, gauge) -> values.put(name, gauge.get()));
        return values;
    }

    private static class CounterImpl implements Counter {
        private final LongAdder value = new LongAdder();

        @Override
        public void inc() {
            value.increment();
        }

        @Override
        public long getCount() {
            return value.sum();
        }
    }
}
