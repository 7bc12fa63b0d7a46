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

import org.querylens.agent.config.ConfigService;
import org.querylens.agent.util.RateLimitedLogger;
import org.querylens.common.config.AdvancedConfig;
import org.querylens.common.util.Clock;

// merges ended transactions into the active harvest interval, merges and drains are mutually
// exclusive
public class Aggregator {

    private final ConfigService configService;
    private final Clock clock;

    private final Object lock = new Object();

    @GuardedBy("lock")
    private HarvestIntervalCollector activeIntervalCollector;

    private final RateLimitedLogger slowQueryLimitLogger =
            new RateLimitedLogger(Aggregator.class);
    private final RateLimitedLogger metricLimitLogger = new RateLimitedLogger(Aggregator.class);

    public Aggregator(ConfigService configService, Clock clock) {
        this.configService = configService;
        this.clock = clock;
        activeIntervalCollector = createIntervalCollector();
    }

    void add(Transaction transaction) {
        synchronized (lock) {
            activeIntervalCollector.add(transaction);
        }
    }

    // swaps in a fresh interval and returns the previous one, this is the only place where
    // harvested data is cleared
    public HarvestIntervalCollector drain() {
        HarvestIntervalCollector drained;
        synchronized (lock) {
            drained = activeIntervalCollector;
            // limits are re-read here so that config changes apply from the next interval
            activeIntervalCollector = createIntervalCollector();
        }
        long slowQueryDroppedCount = drained.getSlowQueryDroppedCount();
        if (slowQueryDroppedCount > 0) {
            slowQueryLimitLogger.warn("the slow query limit of {} per harvest interval was"
                    + " exceeded, {} slow queries were dropped",
                    drained.getMaxSlowQueries(), slowQueryDroppedCount);
        }
        long metricDroppedCount = drained.getMetricDroppedCount();
        if (metricDroppedCount > 0) {
            metricLimitLogger.warn("the metric limit of {} per harvest interval was exceeded, {}"
                    + " metrics were dropped", drained.getMaxMetrics(), metricDroppedCount);
        }
        return drained;
    }

    private HarvestIntervalCollector createIntervalCollector() {
        AdvancedConfig advancedConfig = configService.getAdvancedConfig();
        return new HarvestIntervalCollector(clock.currentTimeMillis(),
                advancedConfig.maxSlowQueries(), advancedConfig.maxMetrics());
    }
}
