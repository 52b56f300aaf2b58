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

package org.apache.resilience.impl.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.time.temporal.ChronoUnit;
import java.util.Enumeration;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Stream;

import javax.annotation.Priority;

import org.apache.resilience.api.config.ConfigFacade;

/**
 * Reads environment variables, then system properties, then the
 * {@code META-INF/resilience/resilience.properties} resources of the classpath. An
 * environment variable also matches in its upper case form with every non alphanumeric
 * character replaced by an underscore.
 */
@Priority(200)
public class DefaultConfigFacade extends ConfigFacade {
    static final String RESOURCE = "META-INF/resilience/resilience.properties";

    private final Properties defaults;

    public DefaultConfigFacade() {
        this(loadDefaults(Thread.currentThread().getContextClassLoader()));
    }

    public DefaultConfigFacade(final Properties defaults) {
        this.defaults = defaults;
    }

    @Override
    public boolean getBoolean(final String name, final boolean defaultValue) {
        return getOptionalValue(name).map(Boolean::parseBoolean).orElse(defaultValue);
    }

    @Override
    public long getLong(final String name, final long defaultValue) {
        return getOptionalValue(name).map(Long::parseLong).orElse(defaultValue);
    }

    @Override
    public int getInt(final String name, final int defaultValue) {
        return getOptionalValue(name).map(Integer::parseInt).orElse(defaultValue);
    }

    @Override
    public double getDouble(final String name, final double defaultValue) {
        return getOptionalValue(name).map(Double::parseDouble).orElse(defaultValue);
    }

    @Override
    public ChronoUnit getChronoUnit(final String name, final ChronoUnit defaultValue) {
        return getOptionalValue(name).map(ChronoUnit::valueOf).orElse(defaultValue);
    }

    @Override
    public String getString(final String name, final String defaultValue) {
        return getOptionalValue(name).orElse(defaultValue);
    }

    @Override
    public Class<? extends Throwable>[] getThrowableClasses(final String name, final Class<? extends Throwable>[] defaultValue) {
        return getOptionalValue(name).map(value -> {
            final ClassLoader loader = Thread.currentThread().getContextClassLoader();
            return Stream.of(value.split(",")).map(String::trim).filter(it -> !it.isEmpty()).map(clazz -> {
                try {
                    return loader.loadClass(clazz).asSubclass(Throwable.class);
                } catch (final ClassNotFoundException e) {
                    throw new IllegalArgumentException(e);
                }
            }).toArray(Class[]::new);
        }).orElse(defaultValue);
    }

    private Optional<String> getOptionalValue(final String name) {
        return Optional.ofNullable(System.getenv(name))
                .or(() -> Optional.ofNullable(System.getenv(toEnvironmentName(name))))
                .or(() -> Optional.ofNullable(System.getProperty(name)))
                .or(() -> Optional.ofNullable(defaults.getProperty(name)))
                .map(String::trim);
    }

    private static String toEnvironmentName(final String name) {
        return name.replaceAll("[^A-Za-z0-9]", "_").toUpperCase(Locale.ROOT);
    }

    private static Properties loadDefaults(final ClassLoader loader) {
        final Properties properties = new Properties();
        try {
            final Enumeration<URL> resources = loader.getResources(RESOURCE);
            while (resources.hasMoreElements()) {
                try (final InputStream stream = resources.nextElement().openStream()) {
                    properties.load(stream);
                }
            }
        } catch (final IOException e) {
            throw new UncheckedIOException("Can't read " + RESOURCE, e);
        }
        return properties;
    }
}
