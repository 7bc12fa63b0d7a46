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

import javax.annotation.concurrent.GuardedBy;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.querylens.agent.model.DatastoreCall;
import org.querylens.agent.model.HarvestSlowQueryCollector;
import org.querylens.agent.model.MetricCollector;
import org.querylens.agent.model.SlowQueryCollector;

// a unit of work (e.g. a web request or a background job) that owns the datastore calls made
// while it is running
//
// calls belonging to one transaction are expected to be sequenced by the caller, the lock is
// primarily for visibility since a transaction may be ended from a different thread than the one
// that recorded its calls
public class Transaction {

    private static final Logger logger = LoggerFactory.getLogger(Transaction.class);

    private final String name;
    private final @Nullable String url;
    private final boolean web;

    private final DatastoreCallRecorder datastoreCallRecorder;
    private final Aggregator aggregator;

    private final Object lock = new Object();

    @GuardedBy("lock")
    private final MetricCollector metrics = MetricCollector.unbounded();
    @GuardedBy("lock")
    private final SlowQueryCollector slowQueries = new SlowQueryCollector();
    @GuardedBy("lock")
    private boolean ended;

    Transaction(String name, @Nullable String url, boolean web,
            DatastoreCallRecorder datastoreCallRecorder, Aggregator aggregator) {
        this.name = name;
        this.url = url;
        this.web = web;
        this.datastoreCallRecorder = datastoreCallRecorder;
        this.aggregator = aggregator;
    }

    public String getName() {
        return name;
    }

    public @Nullable String getUrl() {
        return url;
    }

    public boolean isWeb() {
        return web;
    }

    public void recordDatastoreCall(DatastoreCall call) {
        synchronized (lock) {
            if (ended) {
                logger.debug("ignoring datastore call recorded after transaction end: {}", name);
                return;
            }
            datastoreCallRecorder.record(this, call, metrics, slowQueries);
        }
    }

    // only the first call has any effect
    public void end() {
        synchronized (lock) {
            if (ended) {
                logger.debug("transaction has already ended: {}", name);
                return;
            }
            ended = true;
        }
        aggregator.add(this);
    }

    public boolean isEnded() {
        synchronized (lock) {
            return ended;
        }
    }

    // ownership of the recorded slow queries moves to the harvest collector
    void mergeInto(HarvestSlowQueryCollector harvestSlowQueries, MetricCollector harvestMetrics) {
        synchronized (lock) {
            slowQueries.mergeInto(harvestSlowQueries);
            metrics.mergeInto(harvestMetrics);
        }
    }
}
