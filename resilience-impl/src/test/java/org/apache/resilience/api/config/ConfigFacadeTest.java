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

import static java.util.Arrays.asList;
import static java.util.Collections.emptyIterator;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.temporal.ChronoUnit;
import java.util.Iterator;
import java.util.ServiceConfigurationError;

import javax.annotation.Priority;

import org.testng.annotations.Test;

public class ConfigFacadeTest {
    @Test
    public void shouldPickLowestPriority() {
        assertThat(ConfigFacade.select(asList(new Alpha(), new Zeta(), new Beta()).iterator()))
                .isInstanceOf(Zeta.class);
    }

    @Test
    public void shouldKeepBothFacadesOfSamePriority() {
        assertThat(ConfigFacade.select(asList(new Beta(), new Alpha()).iterator())).isInstanceOf(Alpha.class);
        assertThat(ConfigFacade.select(asList(new Alpha(), new Beta()).iterator())).isInstanceOf(Alpha.class);
    }

    @Test
    public void shouldSkipProvidersFailingToLoad() {
        final Iterator<ConfigFacade> providers = new Iterator<ConfigFacade>() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < 2;
            }

            @Override
            public ConfigFacade next() {
                if (index++ == 0) {
                    throw new ServiceConfigurationError("no MicroProfile Config");
                }
                return new Beta();
            }
        };
        assertThat(ConfigFacade.select(providers)).isInstanceOf(Beta.class);
    }

    @Test
    public void shouldFailWithoutProvider() {
        assertThatThrownBy(() -> ConfigFacade.select(emptyIterator())).isInstanceOf(IllegalStateException.class);
    }

    private abstract static class StubFacade extends ConfigFacade {
        @Override
        public boolean getBoolean(final String name, final boolean defaultValue) {
            return defaultValue;
        }

        @Override
        public long getLong(final String name, final long defaultValue) {
            return defaultValue;
        }

        @Override
        public int getInt(final String name, final int defaultValue) {
            return defaultValue;
        }

        @Override
        public double getDouble(final String name, final double defaultValue) {
            return defaultValue;
        }

        @Override
        public ChronoUnit getChronoUnit(final String name, final ChronoUnit defaultValue) {
            return defaultValue;
        }

        @Override
        public String getString(final String name, final String defaultValue) {
            return defaultValue;
        }

        @Override
        public Class<? extends Throwable>[] getThrowableClasses(final String name,
                                                                final Class<? extends Throwable>[] defaultValue) {
            return defaultValue;
        }
    }

    @Priority(50)
    private static class Alpha extends StubFacade {
    }

    @Priority(50)
    private static class Beta extends StubFacade {
    }

    @Priority(10)
    private static class Zeta extends StubFacade {
    }
}
