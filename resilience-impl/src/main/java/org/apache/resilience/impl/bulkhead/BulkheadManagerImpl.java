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

import static java.util.Collections.unmodifiableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

import javax.enterprise.inject.Vetoed;

import org.apache.resilience.api.bulkhead.Bulkhead;
import org.apache.resilience.api.bulkhead.BulkheadDefinition;
import org.apache.resilience.api.bulkhead.BulkheadManager;
import org.apache.resilience.impl.metrics.InMemoryResilienceMetrics;
import org.apache.resilience.impl.metrics.ResilienceMetrics;

@Vetoed
public class BulkheadManagerImpl implements BulkheadManager {
    private final ConcurrentMap<String, SemaphoreBulkhead> bulkheads = new ConcurrentHashMap<>();
    private final Function<String, BulkheadDefinition> defaults;
    private final ResilienceMetrics metrics;

    public BulkheadManagerImpl() {
        this(name -> new BulkheadBuilderImpl(name).build(), new InMemoryResilienceMetrics());
    }

    public BulkheadManagerImpl(final Function<String, BulkheadDefinition> defaults, final ResilienceMetrics metrics) {
        this.defaults = defaults;
        this.metrics = metrics;
    }

    @Override
    public BulkheadBuilderImpl newBulkhead(final String name) {
        return new BulkheadBuilderImpl(name, this);
    }

    @Override
    public SemaphoreBulkhead getBulkhead(final String name) {
        SemaphoreBulkhead bulkhead = bulkheads.get(name);
        if (bulkhead == null) {
            bulkhead = new SemaphoreBulkhead(defaults.apply(name), metrics);
            final SemaphoreBulkhead existing = bulkheads.putIfAbsent(name, bulkhead);
            if (existing != null) {
                bulkhead = existing;
            }
        }
        return bulkhead;
    }

    @Override
    public void remove(final String name) {
        bulkheads.remove(name);
    }

    @Override
    public Map<String, Bulkhead> list() {
        return unmodifiableMap(new LinkedHashMap<>(bulkheads));
    }

    void register(final String name, final BulkheadDefinition definition) {
        bulkheads.put(name, new SemaphoreBulkhead(definition, metrics));
    }
}
