/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.querylens.common.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import org.querylens.common.util.ObjectMappers;

import static org.assertj.core.api.Assertions.assertThat;

public class ConfigBindingTest {

    private static final ObjectMapper mapper = ObjectMappers.create();

    @Test
    public void shouldUseDefaultsForMissingProperties() throws Exception {
        // when
        DatastoreTracerConfig config = mapper.readValue("{}", DatastoreTracerConfig.class);
        // then
        assertThat(config.slowQueryEnabled()).isTrue();
        assertThat(config.slowQueryThresholdMillis()).isEqualTo(10);
        assertThat(config.queryParametersEnabled()).isTrue();
        assertThat(config.instanceReportingEnabled()).isTrue();
        assertThat(config.databaseNameReportingEnabled()).isTrue();
    }

    @Test
    public void shouldReadDatastoreTracerConfig() throws Exception {
        // when
        DatastoreTracerConfig config = mapper.readValue("{\"slowQueryEnabled\":false,"
                + "\"slowQueryThresholdMillis\":0,\"instanceReportingEnabled\":false}",
                DatastoreTracerConfig.class);
        // then
        assertThat(config.slowQueryEnabled()).isFalse();
        assertThat(config.slowQueryThresholdMillis()).isZero();
        assertThat(config.instanceReportingEnabled()).isFalse();
        assertThat(config.queryParametersEnabled()).isTrue();
    }

    @Test
    public void shouldIgnoreUnknownProperties() throws Exception {
        // when
        AdvancedConfig config = mapper.readValue("{\"maxSlowQueries\":25,\"notAThing\":1}",
                AdvancedConfig.class);
        // then
        assertThat(config.maxSlowQueries()).isEqualTo(25);
        assertThat(config.maxQueryParameterKeyLength()).isEqualTo(255);
        assertThat(config.maxQueryParameterValueLength()).isEqualTo(255);
        assertThat(config.harvestIntervalSeconds()).isEqualTo(60);
    }

    @Test
    public void shouldWriteAndReadBack() throws Exception {
        // given
        GeneralConfig config = ImmutableGeneralConfig.builder()
                .highSecurity(true)
                .build();
        // when
        String json = mapper.writeValueAsString(config);
        // then
        assertThat(mapper.readValue(json, GeneralConfig.class)).isEqualTo(config);
    }
}
