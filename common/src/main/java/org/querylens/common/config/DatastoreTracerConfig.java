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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableDatastoreTracerConfig.class)
@JsonDeserialize(as = ImmutableDatastoreTracerConfig.class)
public abstract class DatastoreTracerConfig {

    @Value.Default
    public boolean slowQueryEnabled() {
        return true;
    }

    // 0 means every datastore call is a slow query candidate
    @Value.Default
    public int slowQueryThresholdMillis() {
        return 10;
    }

    // ignored (always off) when running in high security mode
    @Value.Default
    public boolean queryParametersEnabled() {
        return true;
    }

    @Value.Default
    public boolean instanceReportingEnabled() {
        return true;
    }

    @Value.Default
    public boolean databaseNameReportingEnabled() {
        return true;
    }
}
