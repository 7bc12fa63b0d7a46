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

import com.google.common.base.Strings;
import com.google.common.base.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;

import org.querylens.agent.config.ConfigService;
import org.querylens.agent.model.DatastoreCall;
import org.querylens.agent.model.DatastoreMetricNames;
import org.querylens.agent.model.ImmutableSlowQuerySample;
import org.querylens.agent.model.InstanceKey;
import org.querylens.agent.model.MetricCollector;
import org.querylens.agent.model.QueryParameters;
import org.querylens.agent.model.SlowQueryCollector;
import org.querylens.agent.model.SlowQueryKey;
import org.querylens.agent.model.SlowQuerySample;
import org.querylens.common.config.AdvancedConfig;
import org.querylens.common.config.DatastoreTracerConfig;

class DatastoreCallRecorder {

    private final ConfigService configService;
    private final SlowQueryGate slowQueryGate;

    DatastoreCallRecorder(ConfigService configService) {
        this.configService = configService;
        slowQueryGate = new SlowQueryGate(configService);
    }

    // must be called under the transaction lock
    void record(final Transaction transaction, final DatastoreCall call, MetricCollector metrics,
            SlowQueryCollector slowQueries) {
        final DatastoreTracerConfig config = configService.getDatastoreTracerConfig();
        String product = DatastoreMetricNames.product(call);
        long durationNanos = call.durationNanos();
        final InstanceKey instanceKey = InstanceKey.resolve(call.host(), call.portPathOrId(),
                config.instanceReportingEnabled());

        recordMetrics(transaction, call, product, instanceKey, durationNanos, metrics);

        if (!slowQueryGate.isSlowQuery(durationNanos)) {
            return;
        }
        SlowQueryKey key = DatastoreMetricNames.slowQueryKey(call);
        slowQueries.record(key, durationNanos, new Supplier<SlowQuerySample>() {
            @Override
            public SlowQuerySample get() {
                return createSample(transaction, call, config, instanceKey);
            }
        });
    }

    private static void recordMetrics(Transaction transaction, DatastoreCall call, String product,
            @Nullable InstanceKey instanceKey, long durationNanos, MetricCollector metrics) {
        boolean web = transaction.isWeb();
        metrics.addForced(DatastoreMetricNames.ALL, durationNanos);
        metrics.addForced(DatastoreMetricNames.allWebOrOtherMetricName(web), durationNanos);
        metrics.addForced(DatastoreMetricNames.productAllMetricName(product), durationNanos);
        metrics.addForced(DatastoreMetricNames.productAllWebOrOtherMetricName(product, web),
                durationNanos);

        String operationMetricName = DatastoreMetricNames.operationMetricName(call);
        metrics.addUnforced(operationMetricName, durationNanos);
        if (call.collection().isEmpty()) {
            metrics.addScoped(operationMetricName, transaction.getName(), durationNanos);
        } else {
            String statementMetricName = DatastoreMetricNames.metricName(call);
            metrics.addUnforced(statementMetricName, durationNanos);
            metrics.addScoped(statementMetricName, transaction.getName(), durationNanos);
        }
        if (instanceKey != null) {
            metrics.addUnforced(DatastoreMetricNames.instanceMetricName(product, instanceKey),
                    durationNanos);
        }
    }

    private SlowQuerySample createSample(Transaction transaction, DatastoreCall call,
            DatastoreTracerConfig config, @Nullable InstanceKey instanceKey) {
        AdvancedConfig advancedConfig = configService.getAdvancedConfig();
        ImmutableSlowQuerySample.Builder builder = ImmutableSlowQuerySample.builder()
                .queryParameters(QueryParameters.sanitize(call.queryParameters(),
                        config.queryParametersEnabled(),
                        configService.getGeneralConfig().highSecurity(),
                        advancedConfig.maxQueryParameterKeyLength(),
                        advancedConfig.maxQueryParameterValueLength()))
                .transactionName(transaction.getName())
                .transactionUrl(Strings.nullToEmpty(transaction.getUrl()));
        if (config.databaseNameReportingEnabled()) {
            builder.databaseName(Strings.nullToEmpty(call.databaseName()));
        }
        if (instanceKey != null) {
            builder.host(instanceKey.host())
                    .portPathOrId(instanceKey.portPathOrId());
        }
        return builder.build();
    }
}
