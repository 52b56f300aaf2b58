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

package org.apache.resilience.api.config;

import static java.util.Comparator.comparingInt;

import java.time.temporal.ChronoUnit;
import java.util.Iterator;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.SortedSet;
import java.util.TreeSet;

import javax.annotation.Priority;

/**
 * Typed configuration lookups. The shared instance is the {@link ServiceLoader} provider
 * with the lowest {@link Priority} value, ties going to the smallest class name; providers
 * failing to initialize are skipped.
 */
public abstract class ConfigFacade {
    private static volatile ConfigFacade instance;

    public abstract boolean getBoolean(String name, boolean defaultValue);
    public abstract long getLong(String name, long defaultValue);
    public abstract int getInt(String name, int defaultValue);
    public abstract double getDouble(String name, double defaultValue);
    public abstract ChronoUnit getChronoUnit(String name, ChronoUnit defaultValue);
    public abstract String getString(String name, String defaultValue);
    public abstract Class<? extends Throwable>[] getThrowableClasses(String name, Class<? extends Throwable>[] defaultValue);

    public static ConfigFacade getInstance() {
        ConfigFacade facade = instance;
        if (facade == null) {
            synchronized (ConfigFacade.class) {
                facade = instance;
                if (facade == null) {
                    facade = load();
                    instance = facade;
                }
            }
        }
        return facade;
    }

    public static void setInstance(final ConfigFacade configFacade) {
        instance = configFacade;
    }

    private static ConfigFacade load() {
        return select(ServiceLoader.load(ConfigFacade.class).iterator());
    }

    static ConfigFacade select(final Iterator<? extends ConfigFacade> iterator) {
        final SortedSet<ConfigFacade> facades = new TreeSet<>(comparingInt(ConfigFacade::priority)
                .thenComparing(facade -> facade.getClass().getName()));
        while (true) {
            try {
                if (!iterator.hasNext()) {
                    break;
                }
                facades.add(iterator.next());
            } catch (final ServiceConfigurationError unavailable) {
                // provider can't start in this environment (no MicroProfile Config for instance), try the next one
                continue;
            }
        }
        if (facades.isEmpty()) {
            throw new IllegalStateException("No " + ConfigFacade.class.getName() + " available");
        }
        return facades.first();
    }

    private static int priority(final ConfigFacade facade) {
        final Priority priority = facade.getClass().getAnnotation(Priority.class);
        return priority == null ? Integer.MAX_VALUE : priority.value();
    }
}
