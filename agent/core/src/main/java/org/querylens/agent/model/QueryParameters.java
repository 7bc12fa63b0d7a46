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

import java.util.Map;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

public class QueryParameters {

    private QueryParameters() {}

    // returns null when nothing is reportable, so that "no parameters" and "all parameters were
    // filtered out" look the same to the consumer
    public static @Nullable ImmutableMap<String, Object> sanitize(
            Map<String, QueryParameterValue> parameters, boolean queryParametersEnabled,
            boolean highSecurity, int maxKeyLength, int maxValueLength) {
        // high security mode wins over everything else
        if (highSecurity || !queryParametersEnabled || parameters.isEmpty()) {
            return null;
        }
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
        int count = 0;
        for (Map.Entry<String, QueryParameterValue> entry : parameters.entrySet()) {
            String key = entry.getKey();
            if (key.length() > maxKeyLength) {
                continue;
            }
            Object value = sanitizeValue(entry.getValue(), maxValueLength);
            if (value == null) {
                continue;
            }
            builder.put(key, value);
            count++;
        }
        if (count == 0) {
            return null;
        }
        return builder.build();
    }

    private static @Nullable Object sanitizeValue(QueryParameterValue parameterValue,
            int maxValueLength) {
        Object value = parameterValue.getValue();
        switch (parameterValue.getKind()) {
            case STRING:
                String str = (String) value;
                if (str != null && str.length() > maxValueLength) {
                    int end = maxValueLength;
                    // do not split a surrogate pair
                    if (end > 0 && Character.isHighSurrogate(str.charAt(end - 1))) {
                        end--;
                    }
                    return str.substring(0, end);
                }
                return str;
            case BOOLEAN:
            case NUMBER:
                return value;
            default:
                return null;
        }
    }
}
