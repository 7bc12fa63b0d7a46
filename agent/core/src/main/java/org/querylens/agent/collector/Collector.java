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
package org.querylens.agent.collector;

import java.util.List;

import org.querylens.agent.model.MetricData;
import org.querylens.agent.model.SlowQuery;

// the transport boundary, implementations ship harvested data to the backend
public interface Collector {

    void init(CollectTracesUpdater collectTracesUpdater) throws Exception;

    void collectHarvest(HarvestReader harvestReader) throws Exception;

    // called by the transport on every (re)connect with the backend's collect traces setting
    interface CollectTracesUpdater {
        void update(boolean collectTraces);
    }

    public interface HarvestReader {
        long startTime();
        long captureTime();
        void accept(HarvestVisitor harvestVisitor) throws Exception;
    }

    public interface HarvestVisitor {
        void visitSlowQueries(List<SlowQuery> slowQueries, long droppedCount) throws Exception;
        void visitMetrics(List<MetricData> metrics, long droppedCount) throws Exception;
    }
}
