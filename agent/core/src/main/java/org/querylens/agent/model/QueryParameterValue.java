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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.Maps;
import org.checkerframework.checker.nullness.qual.Nullable;

// query parameters arrive as arbitrary objects, only string, boolean and numeric scalar values
// are ever reported, everything else is captured as UNSUPPORTED and dropped by QueryParameters
public final class QueryParameterValue {

    private static final QueryParameterValue UNSUPPORTED =
            new QueryParameterValue(Kind.UNSUPPORTED, null);

    private final Kind kind;
    private final @Nullable Object value;

    private QueryParameterValue(Kind kind, @Nullable Object value) {
        this.kind = kind;
        this.value = value;
    }

    public Kind getKind() {
        return kind;
    }

    // null only for UNSUPPORTED
    public @Nullable Object getValue() {
        return value;
    }

    public static QueryParameterValue of(@Nullable Object value) {
        if (value instanceof String) {
            return new QueryParameterValue(Kind.STRING, value);
        }
        if (value instanceof Boolean) {
            return new QueryParameterValue(Kind.BOOLEAN, value);
        }
        if (isNumericScalar(value)) {
            return new QueryParameterValue(Kind.NUMBER, value);
        }
        return UNSUPPORTED;
    }

    // null keys are skipped, null values are captured as UNSUPPORTED
    public static Map<String, QueryParameterValue> ofAll(@Nullable Map<String, ?> parameters) {
        Map<String, QueryParameterValue> values = Maps.newLinkedHashMap();
        if (parameters == null) {
            return values;
        }
        for (Map.Entry<String, ?> entry : parameters.entrySet()) {
            String key = entry.getKey();
            if (key != null) {
                values.put(key, of(entry.getValue()));
            }
        }
        return values;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof QueryParameterValue)) {
            return false;
        }
        QueryParameterValue that = (QueryParameterValue) obj;
        return kind == that.kind && Objects.equal(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(kind, value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("kind", kind)
                .add("value", value)
                .toString();
    }

    // mutable Number implementations (e.g. AtomicLong) are not scalars
    private static boolean isNumericScalar(@Nullable Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Double
                || value instanceof Float || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger || value instanceof BigDecimal;
    }

    public enum Kind {
        STRING, BOOLEAN, NUMBER, UNSUPPORTED
    }
}
