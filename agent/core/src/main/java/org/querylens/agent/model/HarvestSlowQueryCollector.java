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

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.primitives.Longs;
import org.checkerframework.checker.nullness.qual.Nullable;

import org.querylens.common.util.OnlyUsedByTests;

import static com.google.common.base.Preconditions.checkArgument;

// slow queries of a harvest interval, bounded to limit distinct keys
//
// once the limit is reached, a new key only gets in by evicting the entry with the smallest total
// duration, and only if its own total duration is strictly greater, so the retained exemplars are
// biased toward the most expensive query shapes
//
// not thread safe, guarded by the aggregator lock
public class HarvestSlowQueryCollector {

    // insertion order matters, among entries tied for the smallest total the earliest is evicted
    private final Map<SlowQueryKey, MutableSlowQuery> slowQueries = Maps.newLinkedHashMap();
    private final int limit;

    private long droppedCount;

    public HarvestSlowQueryCollector(int limit) {
        checkArgument(limit > 0, "limit must be positive: %s", limit);
        this.limit = limit;
    }

    // takes ownership of the slow query when it is retained
    public void mergeSlowQuery(SlowQueryKey key, MutableSlowQuery slowQuery) {
        MutableSlowQuery existing = slowQueries.get(key);
        if (existing != null) {
            existing.add(slowQuery);
            return;
        }
        if (slowQueries.size() < limit) {
            slowQueries.put(key, slowQuery);
            return;
        }
        Map.Entry<SlowQueryKey, MutableSlowQuery> smallest = getSmallestEntry();
        if (smallest != null && slowQuery.getTotalDurationNanos() > smallest.getValue()
                .getTotalDurationNanos()) {
            slowQueries.remove(smallest.getKey());
            slowQueries.put(key, slowQuery);
        }
        droppedCount++;
    }

    @OnlyUsedByTests
    public int size() {
        return slowQueries.size();
    }

    public boolean isEmpty() {
        return slowQueries.isEmpty();
    }

    // number of slow queries that did not make it into (or were evicted from) this interval
    public long getDroppedCount() {
        return droppedCount;
    }

    // reverse sorted by total duration
    public List<SlowQuery> toSlowQueries() {
        List<SlowQuery> list = Lists.newArrayListWithCapacity(slowQueries.size());
        for (Map.Entry<SlowQueryKey, MutableSlowQuery> entry : slowQueries.entrySet()) {
            list.add(entry.getValue().toSlowQuery(entry.getKey()));
        }
        Collections.sort(list, new Comparator<SlowQuery>() {
            @Override
            public int compare(SlowQuery left, SlowQuery right) {
                return Longs.compare(right.totalDurationNanos(), left.totalDurationNanos());
            }
        });
        return list;
    }

    // totals of existing entries change on every merge, so the smallest is found on demand
    private Map.@Nullable Entry<SlowQueryKey, MutableSlowQuery> getSmallestEntry() {
        Map.Entry<SlowQueryKey, MutableSlowQuery> smallest = null;
        for (Map.Entry<SlowQueryKey, MutableSlowQuery> entry : slowQueries.entrySet()) {
            if (smallest == null || entry.getValue().getTotalDurationNanos() < smallest
                    .getValue().getTotalDurationNanos()) {
                smallest = entry;
            }
        }
        return smallest;
    }
}
