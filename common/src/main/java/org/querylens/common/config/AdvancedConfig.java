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
@JsonSerialize(as = ImmutableAdvancedConfig.class)
@JsonDeserialize(as = ImmutableAdvancedConfig.class)
public abstract class AdvancedConfig {

    // used to limit memory requirement and transmission volume
    // applied per harvest interval, not per transaction
    @Value.Default
    public int maxSlowQueries() {
        return 10;
    }

    @Value.Default
    public int maxQueryParameterKeyLength() {
        return 255;
    }

    @Value.Default
    public int maxQueryParameterValueLength() {
        return 255;
    }

    // forced metrics are kept even after this limit is reached
    @Value.Default
    public int maxMetrics() {
        return 2000;
    }

    @Value.Default
    public int harvestIntervalSeconds() {
        return 60;
    }
}
