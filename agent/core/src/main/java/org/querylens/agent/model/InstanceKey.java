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
import org.immutables.value.Value;

import org.querylens.common.util.Styles;

@Value.Immutable
@Styles.AllParameters
public abstract class InstanceKey {

    static final String UNKNOWN = "unknown";

    public abstract String host();

    public abstract String portPathOrId();

    // returns null when there is nothing to report, in which case no instance metric is recorded
    // and the slow query sample carries neither host nor port
    public static @Nullable InstanceKey resolve(@Nullable String host,
            @Nullable String portPathOrId, boolean instanceReportingEnabled) {
        if (!instanceReportingEnabled) {
            return null;
        }
        boolean hasHost = !Strings.isNullOrEmpty(host);
        boolean hasPort = !Strings.isNullOrEmpty(portPathOrId);
        if (!hasHost && !hasPort) {
            return null;
        }
        return ImmutableInstanceKey.of(hasHost ? host : UNKNOWN, hasPort ? portPathOrId : UNKNOWN);
    }
}
