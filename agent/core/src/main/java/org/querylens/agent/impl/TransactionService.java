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

import org.checkerframework.checker.nullness.qual.Nullable;

import org.querylens.agent.config.ConfigService;

public class TransactionService {

    private final DatastoreCallRecorder datastoreCallRecorder;
    private final Aggregator aggregator;

    public TransactionService(ConfigService configService, Aggregator aggregator) {
        datastoreCallRecorder = new DatastoreCallRecorder(configService);
        this.aggregator = aggregator;
    }

    public Transaction startTransaction(String name, @Nullable String url, boolean web) {
        return new Transaction(name, url, web, datastoreCallRecorder, aggregator);
    }
}
