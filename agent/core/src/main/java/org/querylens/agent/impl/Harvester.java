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

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;

import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.querylens.agent.collector.Collector;
import org.querylens.common.util.Clock;

import static com.google.common.base.Preconditions.checkState;
import static java.util.concurrent.TimeUnit.SECONDS;

// periodically drains the aggregator and hands the drained interval to the collector
//
// harvested data from a failed flush is not retried, retrying is up to the collector
public class Harvester implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(Harvester.class);

    private final Aggregator aggregator;
    private final Collector collector;
    private final Clock clock;

    private volatile @MonotonicNonNull ScheduledFuture<?> future;

    public Harvester(Aggregator aggregator, Collector collector, Clock clock) {
        this.aggregator = aggregator;
        this.collector = collector;
        this.clock = clock;
    }

    // the executor is expected to be single threaded so that harvests never overlap
    public void schedule(ScheduledExecutorService executor, long harvestIntervalSeconds) {
        checkState(future == null, "harvester has already been scheduled");
        future = executor.scheduleWithFixedDelay(this, harvestIntervalSeconds,
                harvestIntervalSeconds, SECONDS);
    }

    public void cancel() {
        if (future != null) {
            future.cancel(false);
        }
    }

    @Override
    public void run() {
        try {
            harvest();
        } catch (Throwable t) {
            // an exception escaping run() would silently cancel all subsequent harvests
            logger.error("error harvesting: {}", t.getMessage(), t);
        }
    }

    private void harvest() throws Exception {
        HarvestIntervalCollector intervalCollector = aggregator.drain();
        if (intervalCollector.isEmpty()) {
            logger.debug("nothing to harvest");
            return;
        }
        intervalCollector.flush(clock.currentTimeMillis(), collector);
    }
}
