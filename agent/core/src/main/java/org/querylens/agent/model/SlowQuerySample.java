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
package org.querylens.agent.model;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.immutables.value.Value;

// the retained example of a slow query, taken from its first occurrence
// fields are empty (or null) when the corresponding reporting flag was disabled at capture time
@Value.Immutable
public abstract class SlowQuerySample {

    @Value.Default
    public String databaseName() {
        return "";
    }

    @Value.Default
    public String host() {
        return "";
    }

    @Value.Default
    public String portPathOrId() {
        return "";
    }

    // already sanitized, null means no parameters to report
    public abstract @Nullable ImmutableMap<String, Object> queryParameters();

    public abstract String transactionName();

    @Value.Default
    public String transactionUrl() {
        return "";
    }
}
