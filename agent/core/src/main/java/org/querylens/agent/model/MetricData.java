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

import org.immutables.value.Value;

// forced metrics are always reported, unforced metrics may be dropped once the metric table is
// full, durations are in nanoseconds
@Value.Immutable
public abstract class MetricData {

    public abstract String name();

    // empty means unscoped
    public abstract String scope();

    public abstract boolean forced();

    public abstract long count();

    public abstract long totalDurationNanos();

    public abstract long exclusiveDurationNanos();

    public abstract long minDurationNanos();

    public abstract long maxDurationNanos();

    // in nanoseconds squared, double to avoid overflow
    public abstract double sumOfSquares();
}
