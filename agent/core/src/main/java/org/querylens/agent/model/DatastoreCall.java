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

import java.util.Map;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.immutables.value.Value;

// a completed datastore call, delivered exactly once per instrumented call after its duration is
// known
//
// product, collection and operation may be left empty, in which case they are reported as
// "Unknown", "unknown" and "other" respectively
@Value.Immutable
public abstract class DatastoreCall {

    @Value.Default
    public String product() {
        return "";
    }

    @Value.Default
    public String collection() {
        return "";
    }

    @Value.Default
    public String operation() {
        return "";
    }

    // expected to already be parameterized or obfuscated by the instrumentation
    public abstract @Nullable String queryText();

    // see QueryParameterValue.ofAll() for building from arbitrary values
    public abstract Map<String, QueryParameterValue> queryParameters();

    public abstract @Nullable String databaseName();

    public abstract @Nullable String host();

    public abstract @Nullable String portPathOrId();

    // nanosecond ticks, same scale as com.google.common.base.Ticker
    public abstract long startTick();

    public abstract long endTick();

    public long durationNanos() {
        // a misbehaving ticker should not produce a negative duration
        return Math.max(0, endTick() - startTick());
    }
}
