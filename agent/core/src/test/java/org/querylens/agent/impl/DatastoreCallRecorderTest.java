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

import java.io.File;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import org.querylens.agent.config.ConfigService;
import org.querylens.agent.model.DatastoreMetricNames;
import org.querylens.agent.model.DatastoreProduct;
import org.querylens.agent.model.ImmutableDatastoreCall;
import org.querylens.agent.model.MetricData;
import org.querylens.agent.model.QueryParameterValue;
import org.querylens.agent.model.SlowQuery;
import org.querylens.common.config.ImmutableDatastoreTracerConfig;
import org.querylens.common.config.ImmutableGeneralConfig;
import org.querylens.common.util.Clock;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.assertj.core.api.Assertions.assertThat;

public class DatastoreCallRecorderTest {

    private static final String TRANSACTION_NAME = "WebTransaction/Go/checkout";

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private ConfigService configService;
    private Aggregator aggregator;
    private TransactionService transactionService;
    private CapturingCollector collector;

    @Before
    public void beforeEachTest() throws Exception {
        File confDir = temporaryFolder.newFolder();
        configService = ConfigService.create(confDir, false);
        configService.updateDatastoreTracerConfig(ImmutableDatastoreTracerConfig.builder()
                .slowQueryThresholdMillis(0)
                .build());
        aggregator = new Aggregator(configService, Clock.systemClock());
        transactionService = new TransactionService(configService, aggregator);
        collector = new CapturingCollector();
    }

    @Test
    public void shouldRecordSlowQueryWithZeroThreshold() throws Exception {
        // given
        Transaction transaction = transactionService.startTransaction(TRANSACTION_NAME,
                "/checkout", true);
        // when
        transaction.recordDatastoreCall(mysqlCall("users", "SELECT", "SELECT * FROM users", 0)
                .databaseName("shop")
                .host("db1")
                .portPathOrId("3306")
                .putQueryParameters("id", QueryParameterValue.of(7))
                .build());
        transaction.end();
        harvest();
        // then
        assertThat(collector.slowQueries).hasSize(1);
        SlowQuery slowQuery = collector.slowQueries.get(0);
        assertThat(slowQuery.count()).isEqualTo(1);
        assertThat(slowQuery.metricName()).isEqualTo("Datastore/statement/MySQL/users/SELECT");
        assertThat(slowQuery.queryText()).isEqualTo("SELECT * FROM users");
        assertThat(slowQuery.databaseName()).isEqualTo("shop");
        assertThat(slowQuery.host()).isEqualTo("db1");
        assertThat(slowQuery.portPathOrId()).isEqualTo("3306");
        assertThat(slowQuery.queryParameters())
                .isEqualTo(ImmutableMap.<String, Object>of("id", 7));
        assertThat(slowQuery.transactionName()).isEqualTo(TRANSACTION_NAME);
        assertThat(slowQuery.transactionUrl()).isEqualTo("/checkout");
    }

    @Test
    public void shouldRejectCallBelowThreshold() throws Exception {
        // given
        configService.updateDatastoreTracerConfig(ImmutableDatastoreTracerConfig.builder()
                .slowQueryThresholdMillis(10)
                .build());
        Transaction transaction = transactionService.startTransaction(TRANSACTION_NAME, null,
                true);
        // when
        transaction.recordDatastoreCall(mysqlCall("users", "SELECT", "select 9ms", 9).build());
        transaction.recordDatastoreCall(mysqlCall("users", "SELECT", "select 10ms", 10).build());
        transaction.end();
        harvest();
        // then
        assertThat(collector.slowQueries).hasSize(1);
        assertThat(collector.slowQueries.get(0).queryText()).isEqualTo("select 10ms");
        assertThat(collector.getMetric(DatastoreMetricNames.ALL, "").count())
                .isEqualTo(2);
    }

    @Test
    public void shouldNotRecordSlowQueryWhenSlowQueriesAreDisabled() throws Exception {
        // given
        configService.updateDatastoreTracerConfig(ImmutableDatastoreTracerConfig.builder()
                .slowQueryEnabled(false)
                .slowQueryThresholdMillis(0)
                .build());
        // when
        recordOneCall();
        // then
        assertThat(collector.slowQueries).isEmpty();
        assertThat(collector.getMetric(DatastoreMetricNames.ALL, "").count())
                .isEqualTo(1);
    }

    @Test
    public void shouldNotRecordSlowQueryWhenCollectorDisablesTraces() throws Exception {
        // given
        configService.updateCollectTraces(false);
        // when
        recordOneCall();
        // then
        assertThat(collector.slowQueries).isEmpty();
        assertThat(collector.getMetric(DatastoreMetricNames.ALL, "").count())
                .isEqualTo(1);
    }

    @Test
    public void shouldAggregateByFingerprint() throws Exception {
        // given
        Transaction transaction = transactionService.startTransaction(TRANSACTION_NAME, null,
                true);
        // when
        transaction.recordDatastoreCall(mysqlCall("users", "INSERT", "", 2).build());
        transaction.recordDatastoreCall(mysqlCall("users", "INSERT", "", 3).build());
        transaction.recordDatastoreCall(ImmutableDatastoreCall.builder()
                .product(DatastoreProduct.POSTGRES)
                .collection("users")
                .operation("INSERT")
                .startTick(0)
                .endTick(MILLISECONDS.toNanos(1))
                .build());
        transaction.end();
        harvest();
        // then
        assertThat(collector.slowQueries).hasSize(2);
        SlowQuery mysql = collector.slowQueries.get(0);
        assertThat(mysql.queryText()).isEqualTo("'INSERT' on 'users' using 'MySQL'");
        assertThat(mysql.count()).isEqualTo(2);
        assertThat(mysql.totalDurationNanos()).isEqualTo(MILLISECONDS.toNanos(5));
        SlowQuery postgres = collector.slowQueries.get(1);
        assertThat(postgres.queryText()).isEqualTo("'INSERT' on 'users' using 'Postgres'");
        assertThat(postgres.count()).isEqualTo(1);
    }

    @Test
    public void shouldSynthesizeEverythingForEmptyCall() throws Exception {
        // given
        Transaction transaction = transactionService.startTransaction(TRANSACTION_NAME, null,
                false);
        // when
        transaction.recordDatastoreCall(ImmutableDatastoreCall.builder()
                .startTick(0)
                .endTick(0)
                .build());
        transaction.end();
        harvest();
        // then
        assertThat(collector.slowQueries).hasSize(1);
        SlowQuery slowQuery = collector.slowQueries.get(0);
        assertThat(slowQuery.metricName()).isEqualTo("Datastore/operation/Unknown/other");
        assertThat(slowQuery.queryText()).isEqualTo("'other' on 'unknown' using 'Unknown'");
        assertThat(slowQuery.host()).isEmpty();
        assertThat(slowQuery.portPathOrId()).isEmpty();
        assertThat(slowQuery.queryParameters()).isNull();
    }

    @Test
    public void shouldNotCaptureParametersInHighSecurityMode() throws Exception {
        // given
        configService.updateGeneralConfig(ImmutableGeneralConfig.builder()
                .highSecurity(true)
                .build());
        Transaction transaction = transactionService.startTransaction(TRANSACTION_NAME, null,
                true);
        // when
        transaction.recordDatastoreCall(mysqlCall("users", "SELECT", "select ?", 1)
                .putQueryParameters("id", QueryParameterValue.of("secret"))
                .build());
        transaction.end();
        harvest();
        // then
        assertThat(collector.slowQueries.get(0).queryParameters()).isNull();
    }

    @Test
    public void shouldSanitizeParameters() throws Exception {
        // given
        Map<String, Object> params = Maps.newLinkedHashMap();
        params.put("str", "zap");
        params.put("int", 123);
        params.put("invalid_value", new Object());
        params.put("long-key", Strings.repeat("A", 300));
        Transaction transaction = transactionService.startTransaction(TRANSACTION_NAME, null,
                true);
        // when
        transaction.recordDatastoreCall(mysqlCall("users", "SELECT", "select ?", 1)
                .queryParameters(QueryParameterValue.ofAll(params))
                .build());
        transaction.end();
        harvest();
        // then
        assertThat(collector.slowQueries.get(0).queryParameters()).isEqualTo(ImmutableMap
                .<String, Object>of("str", "zap", "int", 123, "long-key",
                        Strings.repeat("A", 255)));
    }

    @Test
    public void shouldNotReportInstanceWhenDisabled() throws Exception {
        // given
        configService.updateDatastoreTracerConfig(ImmutableDatastoreTracerConfig.builder()
                .slowQueryThresholdMillis(0)
                .instanceReportingEnabled(false)
                .build());
        Transaction transaction = transactionService.startTransaction(TRANSACTION_NAME, null,
                true);
        // when
        transaction.recordDatastoreCall(mysqlCall("users", "SELECT", "select 1", 1)
                .host("db1")
                .portPathOrId("3306")
                .build());
        transaction.end();
        harvest();
        // then
        SlowQuery slowQuery = collector.slowQueries.get(0);
        assertThat(slowQuery.host()).isEmpty();
        assertThat(slowQuery.portPathOrId()).isEmpty();
        for (MetricData metric : collector.metrics) {
            assertThat(metric.name()).doesNotStartWith("Datastore/instance/");
        }
    }

    @Test
    public void shouldResolveMissingPort() throws Exception {
        // given
        Transaction transaction = transactionService.startTransaction(TRANSACTION_NAME, null,
                true);
        // when
        transaction.recordDatastoreCall(mysqlCall("users", "SELECT", "select 1", 1)
                .host("db1")
                .build());
        transaction.end();
        harvest();
        // then
        SlowQuery slowQuery = collector.slowQueries.get(0);
        assertThat(slowQuery.host()).isEqualTo("db1");
        assertThat(slowQuery.portPathOrId()).isEqualTo("unknown");
        assertThat(collector.getMetricNames()).contains("Datastore/instance/MySQL/db1/unknown");
    }

    @Test
    public void shouldNotReportDatabaseNameWhenDisabled() throws Exception {
        // given
        configService.updateDatastoreTracerConfig(ImmutableDatastoreTracerConfig.builder()
                .slowQueryThresholdMillis(0)
                .databaseNameReportingEnabled(false)
                .build());
        Transaction transaction = transactionService.startTransaction(TRANSACTION_NAME, null,
                true);
        // when
        transaction.recordDatastoreCall(mysqlCall("users", "SELECT", "select 1", 1)
                .databaseName("shop")
                .build());
        transaction.end();
        harvest();
        // then
        assertThat(collector.slowQueries.get(0).databaseName()).isEmpty();
    }

    @Test
    public void shouldRecordRollupMetricsForStatement() throws Exception {
        // given
        Transaction transaction = transactionService.startTransaction(TRANSACTION_NAME, null,
                true);
        // when
        transaction.recordDatastoreCall(mysqlCall("users", "SELECT", "select 1", 1)
                .host("db1")
                .portPathOrId("3306")
                .build());
        transaction.end();
        harvest();
        // then
        assertThat(collector.getMetricNames()).containsExactlyInAnyOrder(
                "Datastore/all",
                "Datastore/allWeb",
                "Datastore/MySQL/all",
                "Datastore/MySQL/allWeb",
                "Datastore/operation/MySQL/SELECT",
                "Datastore/statement/MySQL/users/SELECT",
                "Datastore/statement/MySQL/users/SELECT [" + TRANSACTION_NAME + "]",
                "Datastore/instance/MySQL/db1/3306");
        assertThat(collector.getMetric("Datastore/all", "").forced()).isTrue();
        assertThat(collector.getMetric("Datastore/MySQL/allWeb", "").forced()).isTrue();
        assertThat(collector.getMetric("Datastore/operation/MySQL/SELECT", "").forced())
                .isFalse();
        assertThat(collector.getMetric("Datastore/instance/MySQL/db1/3306", "").forced())
                .isFalse();
    }

    @Test
    public void shouldRecordRollupMetricsForOperation() throws Exception {
        // given
        Transaction transaction = transactionService.startTransaction("OtherTransaction/job",
                null, false);
        // when
        transaction.recordDatastoreCall(ImmutableDatastoreCall.builder()
                .product(DatastoreProduct.REDIS)
                .operation("GET")
                .startTick(0)
                .endTick(100)
                .build());
        transaction.end();
        harvest();
        // then
        assertThat(collector.getMetricNames()).containsExactlyInAnyOrder(
                "Datastore/all",
                "Datastore/allOther",
                "Datastore/Redis/all",
                "Datastore/Redis/allOther",
                "Datastore/operation/Redis/GET",
                "Datastore/operation/Redis/GET [OtherTransaction/job]");
        MetricData metric = collector.getMetric("Datastore/all", "");
        assertThat(metric.totalDurationNanos()).isEqualTo(100);
        assertThat(metric.exclusiveDurationNanos()).isEqualTo(100);
    }

    private void recordOneCall() throws Exception {
        Transaction transaction = transactionService.startTransaction(TRANSACTION_NAME, null,
                true);
        transaction.recordDatastoreCall(mysqlCall("users", "SELECT", "select 1", 100).build());
        transaction.end();
        harvest();
    }

    private void harvest() throws Exception {
        aggregator.drain().flush(System.currentTimeMillis(), collector);
    }

    private static ImmutableDatastoreCall.Builder mysqlCall(String collection, String operation,
            String queryText, long durationMillis) {
        return ImmutableDatastoreCall.builder()
                .product(DatastoreProduct.MYSQL)
                .collection(collection)
                .operation(operation)
                .queryText(queryText)
                .startTick(1000)
                .endTick(1000 + MILLISECONDS.toNanos(durationMillis));
    }
}
