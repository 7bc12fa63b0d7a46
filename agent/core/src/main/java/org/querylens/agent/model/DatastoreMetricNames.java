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

import com.google.common.base.Strings;
import org.checkerframework.checker.nullness.qual.Nullable;

// derives the metric names and the display query text for a datastore call
//
// all methods are total, empty product, collection and operation are replaced by UNKNOWN_PRODUCT,
// UNKNOWN_COLLECTION and UNKNOWN_OPERATION
public class DatastoreMetricNames {

    public static final String UNKNOWN_PRODUCT = "Unknown";
    public static final String UNKNOWN_COLLECTION = "unknown";
    public static final String UNKNOWN_OPERATION = "other";

    public static final String ALL = "Datastore/all";
    public static final String ALL_WEB = "Datastore/allWeb";
    public static final String ALL_OTHER = "Datastore/allOther";

    private static final String PREFIX = "Datastore/";
    private static final String STATEMENT_PREFIX = "Datastore/statement/";
    private static final String OPERATION_PREFIX = "Datastore/operation/";
    private static final String INSTANCE_PREFIX = "Datastore/instance/";

    private DatastoreMetricNames() {}

    public static String product(DatastoreCall call) {
        return defaultIfEmpty(call.product(), UNKNOWN_PRODUCT);
    }

    public static String operation(DatastoreCall call) {
        return defaultIfEmpty(call.operation(), UNKNOWN_OPERATION);
    }

    // the fingerprint of a call for slow query aggregation
    public static SlowQueryKey slowQueryKey(DatastoreCall call) {
        return ImmutableSlowQueryKey.of(metricName(call), displayQuery(call));
    }

    // statement metric when the collection is known, otherwise operation metric
    public static String metricName(DatastoreCall call) {
        if (call.collection().isEmpty()) {
            return operationMetricName(call);
        }
        return STATEMENT_PREFIX + product(call) + '/' + call.collection() + '/'
                + operation(call);
    }

    public static String displayQuery(DatastoreCall call) {
        String queryText = call.queryText();
        if (!Strings.isNullOrEmpty(queryText)) {
            return queryText;
        }
        return "'" + operation(call) + "' on '"
                + defaultIfEmpty(call.collection(), UNKNOWN_COLLECTION) + "' using '"
                + product(call) + "'";
    }

    public static String operationMetricName(DatastoreCall call) {
        return OPERATION_PREFIX + product(call) + '/' + operation(call);
    }

    public static String productAllMetricName(String product) {
        return PREFIX + product + "/all";
    }

    public static String productAllWebOrOtherMetricName(String product, boolean web) {
        return PREFIX + product + (web ? "/allWeb" : "/allOther");
    }

    public static String allWebOrOtherMetricName(boolean web) {
        return web ? ALL_WEB : ALL_OTHER;
    }

    public static String instanceMetricName(String product, InstanceKey instanceKey) {
        return INSTANCE_PREFIX + product + '/' + instanceKey.host() + '/'
                + instanceKey.portPathOrId();
    }

    private static String defaultIfEmpty(@Nullable String value, String defaultValue) {
        return Strings.isNullOrEmpty(value) ? defaultValue : value;
    }
}
