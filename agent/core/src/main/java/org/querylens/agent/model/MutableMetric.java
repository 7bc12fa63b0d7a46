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

// not thread safe, owned by exactly one collector at a time
class MutableMetric {

    private final boolean forced;

    private long count;
    private long totalDurationNanos;
    private long exclusiveDurationNanos;
    private long minDurationNanos;
    private long maxDurationNanos;
    private double sumOfSquares;

    MutableMetric(boolean forced) {
        this.forced = forced;
    }

    boolean isForced() {
        return forced;
    }

    void add(long durationNanos, long exclusiveDurationNanos) {
        if (count == 0 || durationNanos < minDurationNanos) {
            minDurationNanos = durationNanos;
        }
        if (count == 0 || durationNanos > maxDurationNanos) {
            maxDurationNanos = durationNanos;
        }
        count++;
        totalDurationNanos += durationNanos;
        this.exclusiveDurationNanos += exclusiveDurationNanos;
        sumOfSquares += (double) durationNanos * durationNanos;
    }

    void add(MutableMetric metric) {
        if (metric.count == 0) {
            return;
        }
        if (count == 0 || metric.minDurationNanos < minDurationNanos) {
            minDurationNanos = metric.minDurationNanos;
        }
        if (count == 0 || metric.maxDurationNanos > maxDurationNanos) {
            maxDurationNanos = metric.maxDurationNanos;
        }
        count += metric.count;
        totalDurationNanos += metric.totalDurationNanos;
        exclusiveDurationNanos += metric.exclusiveDurationNanos;
        sumOfSquares += metric.sumOfSquares;
    }

    MetricData toMetricData(MetricKey key) {
        return ImmutableMetricData.builder()
                .name(key.name())
                .scope(key.scope())
                .forced(forced)
                .count(count)
                .totalDurationNanos(totalDurationNanos)
                .exclusiveDurationNanos(exclusiveDurationNanos)
                .minDurationNanos(minDurationNanos)
                .maxDurationNanos(maxDurationNanos)
                .sumOfSquares(sumOfSquares)
                .build();
    }
}
