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

import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.checkerframework.checker.nullness.qual.Nullable;

import org.querylens.common.util.OnlyUsedByTests;

// rollup metric table
//
// forced metrics are always kept, unforced metrics are dropped once the table holds maxMetrics
// distinct metrics
//
// not thread safe, guarded by the owner (transaction or aggregator)
public class MetricCollector {

    private final Map<MetricKey, MutableMetric> metrics = Maps.newLinkedHashMap();
    private final int maxMetrics;

    private long droppedCount;

    public MetricCollector(int maxMetrics) {
        this.maxMetrics = maxMetrics;
    }

    // for per-transaction tables, where the limit is applied later, at merge time
    public static MetricCollector unbounded() {
        return new MetricCollector(Integer.MAX_VALUE);
    }

    public void addForced(String name, long durationNanos) {
        add(ImmutableMetricKey.of(name, ""), true, durationNanos);
    }

    public void addUnforced(String name, long durationNanos) {
        add(ImmutableMetricKey.of(name, ""), false, durationNanos);
    }

    public void addScoped(String name, String scope, long durationNanos) {
        add(ImmutableMetricKey.of(name, scope), false, durationNanos);
    }

    public void mergeInto(MetricCollector collector) {
        for (Map.Entry<MetricKey, MutableMetric> entry : metrics.entrySet()) {
            collector.mergeMetric(entry.getKey(), entry.getValue());
        }
    }

    public boolean isEmpty() {
        return metrics.isEmpty();
    }

    @OnlyUsedByTests
    public int size() {
        return metrics.size();
    }

    public long getDroppedCount() {
        return droppedCount;
    }

    public List<MetricData> toMetricData() {
        List<MetricData> list = Lists.newArrayListWithCapacity(metrics.size());
        for (Map.Entry<MetricKey, MutableMetric> entry : metrics.entrySet()) {
            list.add(entry.getValue().toMetricData(entry.getKey()));
        }
        return list;
    }

    private void add(MetricKey key, boolean forced, long durationNanos) {
        MutableMetric metric = getOrCreate(key, forced);
        if (metric != null) {
            // datastore calls are leaves, exclusive time equals total time
            metric.add(durationNanos, durationNanos);
        }
    }

    private void mergeMetric(MetricKey key, MutableMetric toBeMerged) {
        MutableMetric metric = getOrCreate(key, toBeMerged.isForced());
        if (metric != null) {
            metric.add(toBeMerged);
        }
    }

    private @Nullable MutableMetric getOrCreate(MetricKey key, boolean forced) {
        MutableMetric metric = metrics.get(key);
        if (metric != null) {
            return metric;
        }
        if (!forced && metrics.size() >= maxMetrics) {
            droppedCount++;
            return null;
        }
        metric = new MutableMetric(forced);
        metrics.put(key, metric);
        return metric;
    }
}
