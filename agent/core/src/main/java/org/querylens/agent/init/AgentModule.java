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
package org.querylens.agent.init;

import java.io.File;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import com.google.common.base.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.querylens.agent.collector.Collector;
import org.querylens.agent.collector.Collector.CollectTracesUpdater;
import org.querylens.agent.config.ConfigService;
import org.querylens.agent.impl.Aggregator;
import org.querylens.agent.impl.Harvester;
import org.querylens.agent.impl.TransactionService;
import org.querylens.agent.util.ThreadFactories;
import org.querylens.common.util.Clock;

import static java.util.concurrent.TimeUnit.SECONDS;

public class AgentModule {

    private static final Logger logger = LoggerFactory.getLogger(AgentModule.class);

    // log startup messages using logger name "org.querylens"
    private static final Logger startupLogger = LoggerFactory.getLogger("org.querylens");

    private final Ticker ticker;

    private final ConfigService configService;
    private final Aggregator aggregator;
    private final TransactionService transactionService;

    private final ScheduledExecutorService harvestExecutor;
    private final Harvester harvester;

    public AgentModule(File confDir, boolean configReadOnly, Collector collector, Clock clock,
            Ticker ticker) {
        this.ticker = ticker;
        configService = ConfigService.create(confDir, configReadOnly);
        try {
            collector.init(new CollectTracesUpdater() {
                @Override
                public void update(boolean collectTraces) {
                    configService.updateCollectTraces(collectTraces);
                }
            });
        } catch (Exception e) {
            // data is still aggregated locally, flushes will be attempted on every harvest
            logger.error("error initializing collector: {}", e.getMessage(), e);
        }
        aggregator = new Aggregator(configService, clock);
        transactionService = new TransactionService(configService, aggregator);

        // single thread so that harvests never overlap
        harvestExecutor = Executors
                .newSingleThreadScheduledExecutor(ThreadFactories.create("QueryLens-Harvest"));
        harvester = new Harvester(aggregator, collector, clock);
        long harvestIntervalSeconds = configService.getAdvancedConfig().harvestIntervalSeconds();
        harvester.schedule(harvestExecutor, harvestIntervalSeconds);
        startupLogger.info("QueryLens agent started (harvest interval {} seconds)",
                harvestIntervalSeconds);
    }

    public Ticker getTicker() {
        return ticker;
    }

    public ConfigService getConfigService() {
        return configService;
    }

    public Aggregator getAggregator() {
        return aggregator;
    }

    public TransactionService getTransactionService() {
        return transactionService;
    }

    // performs one last harvest so that data from the final partial interval is not lost
    public void close() throws InterruptedException {
        harvester.cancel();
        harvestExecutor.shutdown();
        if (!harvestExecutor.awaitTermination(10, SECONDS)) {
            throw new IllegalStateException("Could not terminate executor");
        }
        harvester.run();
    }
}
