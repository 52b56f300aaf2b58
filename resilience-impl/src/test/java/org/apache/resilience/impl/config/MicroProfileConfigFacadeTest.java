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

import java.io.IOException;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;

import org.apache.resilience.api.config.ConfigFacade;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.Test;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;

public class MicroProfileConfigFacadeTest {
    @AfterMethod
    public void resetFacade() {
        ConfigFacade.setInstance(null);
    }

    @Test
    public void readsMicroProfileConfig() {
        final Map<String, String> values = new HashMap<>();
        values.put("mp/Retry/maxAttempts", "4");
        values.put("mp/Retry/jitter", "0.1");
        values.put("mp/Retry/initialDelay", "3");
        values.put("mp/Retry/initialDelayUnit", "SECONDS");
        values.put("mp/Retry/retryOn", IOException.class.getName());
        values.put("mp/Bulkhead/enabled", "true");
        final MicroProfileConfigFacade facade = new MicroProfileConfigFacade(new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(values, "test", 500))
                .build());

        assertThat(facade.getInt("mp/Retry/maxAttempts", 0)).isEqualTo(4);
        assertThat(facade.getDouble("mp/Retry/jitter", 0)).isEqualTo(0.1);
        assertThat(facade.getLong("mp/Retry/initialDelay", 0)).isEqualTo(3);
        assertThat(facade.getChronoUnit("mp/Retry/initialDelayUnit", ChronoUnit.MILLIS)).isEqualTo(ChronoUnit.SECONDS);
        assertThat(facade.getBoolean("mp/Bulkhead/enabled", false)).isTrue();
        assertThat(facade.getString("mp/missing", "none")).isEqualTo("none");
        assertThat(facade.getThrowableClasses("mp/Retry/retryOn", null)).containsExactly(IOException.class);
    }

    @Test
    public void isPreferredWhenAvailable() {
        ConfigFacade.setInstance(null);
        assertThat(ConfigFacade.getInstance())
                .isInstanceOf(MicroProfileConfigFacade.class)
                .isSameAs(ConfigFacade.getInstance());

        final DefaultConfigFacade custom = new DefaultConfigFacade(new java.util.Properties());
        ConfigFacade.setInstance(custom);
        assertThat(ConfigFacade.getInstance()).isSameAs(custom);
    }
}
