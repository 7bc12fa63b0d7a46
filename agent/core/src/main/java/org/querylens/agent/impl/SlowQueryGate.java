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

import org.querylens.agent.config.ConfigService;
import org.querylens.common.config.DatastoreTracerConfig;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

// decides whether a datastore call is captured as a slow query, rollup metrics are recorded
// either way
class SlowQueryGate {

    private final ConfigService configService;

    SlowQueryGate(ConfigService configService) {
        this.configService = configService;
    }

    boolean isSlowQuery(long durationNanos) {
        if (!configService.isCollectTraces()) {
            return false;
        }
        DatastoreTracerConfig config = configService.getDatastoreTracerConfig();
        if (!config.slowQueryEnabled()) {
            return false;
        }
        return durationNanos >= MILLISECONDS.toNanos(config.slowQueryThresholdMillis());
    }
}
