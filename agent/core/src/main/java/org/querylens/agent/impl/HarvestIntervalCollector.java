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
package org.querylens.agent.impl;

import java.util.List;

import javax.annotation.concurrent.GuardedBy;

import org.querylens.agent.collector.Collector;
import org.querylens.agent.collector.Collector.HarvestReader;
import org.querylens.agent.collector.Collector.HarvestVisitor;
import org.querylens.agent.model.HarvestSlowQueryCollector;
import org.querylens.agent.model.MetricCollector;
import org.querylens.agent.model.MetricData;
import org.querylens.agent.model.SlowQuery;

public class HarvestIntervalCollector {

    private final long startTime;
    private final int maxSlowQueries;
    private final int maxMetrics;

    @GuardedBy("lock")
    private final HarvestSlowQueryCollector slowQueries;
    @GuardedBy("lock")
    private final MetricCollector metrics;

    // lock is primarily for visibility (merges happen under the aggregator lock on application
    // threads, and flush happens afterwards on the harvest thread)
    private final Object lock = new Object();

    HarvestIntervalCollector(long startTime, int maxSlowQueries, int maxMetrics) {
        this.startTime = startTime;
        this.maxSlowQueries = maxSlowQueries;
        this.maxMetrics = maxMetrics;
        slowQueries = new HarvestSlowQueryCollector(maxSlowQueries);
        metrics = new MetricCollector(maxMetrics);
    }

    public long getStartTime() {
        return startTime;
    }

    public int getMaxSlowQueries() {
        return maxSlowQueries;
    }

    public int getMaxMetrics() {
        return maxMetrics;
    }

    void add(Transaction transaction) {
        synchronized (lock) {
            transaction.mergeInto(slowQueries, metrics);
        }
    }

    public boolean isEmpty() {
        synchronized (lock) {
            return slowQueries.isEmpty() && metrics.isEmpty();
        }
    }

    public long getSlowQueryDroppedCount() {
        synchronized (lock) {
            return slowQueries.getDroppedCount();
        }
    }

    public long getMetricDroppedCount() {
        synchronized (lock) {
            return metrics.getDroppedCount();
        }
    }

    void flush(long captureTime, Collector collector) throws Exception {
        final List<SlowQuery> slowQueryList;
        final List<MetricData> metricList;
        final long slowQueryDroppedCount;
        final long metricDroppedCount;
        synchronized (lock) {
            slowQueryList = slowQueries.toSlowQueries();
            metricList = metrics.toMetricData();
            slowQueryDroppedCount = slowQueries.getDroppedCount();
            metricDroppedCount = metrics.getDroppedCount();
        }
        collector.collectHarvest(new HarvestReaderImpl(startTime, captureTime, slowQueryList,
                slowQueryDroppedCount, metricList, metricDroppedCount));
    }

    private static class HarvestReaderImpl implements HarvestReader {

        private final long startTime;
        private final long captureTime;
        private final List<SlowQuery> slowQueries;
        private final long slowQueryDroppedCount;
        private final List<MetricData> metrics;
        private final long metricDroppedCount;

        private HarvestReaderImpl(long startTime, long captureTime, List<SlowQuery> slowQueries,
                long slowQueryDroppedCount, List<MetricData> metrics, long metricDroppedCount) {
            this.startTime = startTime;
            this.captureTime = captureTime;
            this.slowQueries = slowQueries;
            this.slowQueryDroppedCount = slowQueryDroppedCount;
            this.metrics = metrics;
            this.metricDroppedCount = metricDroppedCount;
        }

        @Override
        public long startTime() {
            return startTime;
        }

        @Override
        public long captureTime() {
            return captureTime;
        }

        @Override
        public void accept(HarvestVisitor harvestVisitor) throws Exception {
            harvestVisitor.visitSlowQueries(slowQueries, slowQueryDroppedCount);
            harvestVisitor.visitMetrics(metrics, metricDroppedCount);
        }
    }
}
