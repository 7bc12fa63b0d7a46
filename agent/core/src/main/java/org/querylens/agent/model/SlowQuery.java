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

// harvested slow query exemplar, durations are in nanoseconds
@Value.Immutable
public abstract class SlowQuery {

    public abstract String metricName();

    public abstract String queryText();

    // stable identifier of the query text, lets the backend correlate exemplars across harvests
    public abstract long queryId();

    public abstract long count();

    public abstract long totalDurationNanos();

    public abstract long minDurationNanos();

    public abstract long maxDurationNanos();

    public abstract String databaseName();

    public abstract String host();

    public abstract String portPathOrId();

    public abstract @Nullable ImmutableMap<String, Object> queryParameters();

    public abstract String transactionName();

    public abstract String transactionUrl();
}
