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

import com.google.common.base.Charsets;
import com.google.common.hash.Hashing;
import com.google.common.primitives.UnsignedInts;

// not thread safe, owned by exactly one collector at a time
public class MutableSlowQuery {

    private final SlowQuerySample sample;

    private long count;
    // nanosecond rollover (292 years) isn't a concern within a single harvest interval
    private long totalDurationNanos;
    private long minDurationNanos;
    private long maxDurationNanos;

    MutableSlowQuery(long durationNanos, SlowQuerySample sample) {
        this.sample = sample;
        count = 1;
        totalDurationNanos = durationNanos;
        minDurationNanos = durationNanos;
        maxDurationNanos = durationNanos;
    }

    public long getTotalDurationNanos() {
        return totalDurationNanos;
    }

    void add(long durationNanos) {
        count++;
        totalDurationNanos += durationNanos;
        minDurationNanos = Math.min(minDurationNanos, durationNanos);
        maxDurationNanos = Math.max(maxDurationNanos, durationNanos);
    }

    // the sample of this instance is retained
    void add(MutableSlowQuery slowQuery) {
        count += slowQuery.count;
        totalDurationNanos += slowQuery.totalDurationNanos;
        minDurationNanos = Math.min(minDurationNanos, slowQuery.minDurationNanos);
        maxDurationNanos = Math.max(maxDurationNanos, slowQuery.maxDurationNanos);
    }

    SlowQuery toSlowQuery(SlowQueryKey key) {
        return ImmutableSlowQuery.builder()
                .metricName(key.metricName())
                .queryText(key.queryText())
                .queryId(queryId(key.queryText()))
                .count(count)
                .totalDurationNanos(totalDurationNanos)
                .minDurationNanos(minDurationNanos)
                .maxDurationNanos(maxDurationNanos)
                .databaseName(sample.databaseName())
                .host(sample.host())
                .portPathOrId(sample.portPathOrId())
                .queryParameters(sample.queryParameters())
                .transactionName(sample.transactionName())
                .transactionUrl(sample.transactionUrl())
                .build();
    }

    static long queryId(String queryText) {
        return UnsignedInts.toLong(
                Hashing.murmur3_32_fixed().hashString(queryText, Charsets.UTF_8).asInt());
    }
}
