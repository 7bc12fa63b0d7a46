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

import com.google.common.base.Supplier;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.querylens.common.util.OnlyUsedByTests;

// slow queries of a single transaction, keyed by fingerprint
//
// there is no limit at this level, a transaction issuing many distinct queries grows this map for
// the lifetime of the transaction, the harvest interval limit is applied at merge time
//
// not thread safe, the owning transaction sequences access
public class SlowQueryCollector {

    private final Map<SlowQueryKey, MutableSlowQuery> slowQueries = Maps.newLinkedHashMap();

    // the sample supplier is only invoked for the first occurrence of a key
    public void record(SlowQueryKey key, long durationNanos,
            Supplier<SlowQuerySample> sampleSupplier) {
        MutableSlowQuery slowQuery = slowQueries.get(key);
        if (slowQuery == null) {
            slowQueries.put(key, new MutableSlowQuery(durationNanos, sampleSupplier.get()));
        } else {
            slowQuery.add(durationNanos);
        }
    }

    @OnlyUsedByTests
    public int size() {
        return slowQueries.size();
    }

    // hands the records over to the harvest collector, this collector must not be used afterwards
    public void mergeInto(HarvestSlowQueryCollector collector) {
        for (Map.Entry<SlowQueryKey, MutableSlowQuery> entry : slowQueries.entrySet()) {
            collector.mergeSlowQuery(entry.getKey(), entry.getValue());
        }
    }

    @OnlyUsedByTests
    public List<SlowQuery> toSlowQueries() {
        List<SlowQuery> list = Lists.newArrayListWithCapacity(slowQueries.size());
        for (Map.Entry<SlowQueryKey, MutableSlowQuery> entry : slowQueries.entrySet()) {
            list.add(entry.getValue().toSlowQuery(entry.getKey()));
        }
        return list;
    }
}
