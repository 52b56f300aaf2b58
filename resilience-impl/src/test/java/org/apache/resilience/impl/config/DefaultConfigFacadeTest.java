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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.temporal.ChronoUnit;
import java.util.Properties;
import java.util.concurrent.TimeoutException;

import org.testng.annotations.Test;

public class DefaultConfigFacadeTest {
    @Test
    public void readsClasspathResource() {
        final DefaultConfigFacade facade = new DefaultConfigFacade();
        assertThat(facade.getInt("classpath/Retry/maxAttempts", 1)).isEqualTo(7);
        assertThat(facade.getChronoUnit("classpath/CircuitBreaker/timeoutUnit", ChronoUnit.MILLIS))
                .isEqualTo(ChronoUnit.SECONDS);
        assertThat(facade.getThrowableClasses("classpath/Retry/retryOn", null))
                .containsExactly(IOException.class, TimeoutException.class);
        assertThat(facade.getString("classpath/missing", "fallback")).isEqualTo("fallback");
    }

    @Test
    public void systemPropertyWinsOverDefaults() {
        final String key = "facade/Retry/maxAttempts";
        final Properties defaults = new Properties();
        defaults.setProperty(key, "2");
        final DefaultConfigFacade facade = new DefaultConfigFacade(defaults);
        assertThat(facade.getInt(key, 0)).isEqualTo(2);

        System.setProperty(key, " 9 ");
        try {
            assertThat(facade.getInt(key, 0)).isEqualTo(9);
        } finally {
            System.clearProperty(key);
        }
    }

    @Test
    public void parsesPrimitives() {
        final Properties defaults = new Properties();
        defaults.setProperty("enabled", "true");
        defaults.setProperty("long", "12345678901");
        defaults.setProperty("double", "0.25");
        final DefaultConfigFacade facade = new DefaultConfigFacade(defaults);
        assertThat(facade.getBoolean("enabled", false)).isTrue();
        assertThat(facade.getLong("long", 0)).isEqualTo(12345678901L);
        assertThat(facade.getDouble("double", 0)).isEqualTo(0.25);
        assertThat(facade.getBoolean("absent", true)).isTrue();
    }

    @Test
    public void failsOnUnknownClass() {
        final Properties defaults = new Properties();
        defaults.setProperty("retryOn", "com.example.MissingException");
        assertThatThrownBy(() -> new DefaultConfigFacade(defaults).getThrowableClasses("retryOn", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasCauseInstanceOf(ClassNotFoundException.class);
    }
}
