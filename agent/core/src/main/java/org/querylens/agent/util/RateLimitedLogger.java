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
package org.querylens.agent.util;

import javax.annotation.concurrent.GuardedBy;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.RateLimiter;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// logs the first warning, then at most one warning per minute along with the number of warnings
// that were suppressed in between
public class RateLimitedLogger {

    private final Logger logger;

    private final RateLimiter warningRateLimiter;

    @GuardedBy("warningRateLimiter")
    private int suppressedCount;

    public RateLimitedLogger(Class<?> clazz) {
        this(LoggerFactory.getLogger(clazz), 1.0 / 60);
    }

    @VisibleForTesting
    RateLimitedLogger(Logger logger, double permitsPerSecond) {
        this.logger = logger;
        warningRateLimiter = RateLimiter.create(permitsPerSecond);
    }

    public void warn(String format, @Nullable Object... args) {
        int suppressed;
        synchronized (warningRateLimiter) {
            if (!warningRateLimiter.tryAcquire()) {
                suppressedCount++;
                return;
            }
            suppressed = suppressedCount;
            suppressedCount = 0;
        }
        // logging happens outside of the lock
        if (suppressed == 0) {
            logger.warn(format + " (this warning will be logged at most once a minute)", args);
        } else {
            logger.warn(format + " (this warning will be logged at most once a minute, {} warnings"
                    + " were suppressed since it was last logged)", appendArg(args, suppressed));
        }
    }

    @VisibleForTesting
    static @Nullable Object[] appendArg(@Nullable Object[] args, int suppressed) {
        if (args.length > 0 && args[args.length - 1] instanceof Throwable) {
            // keep the throwable last so that slf4j still treats it as the exception
            @Nullable
            Object[] argsPlus = new Object[args.length + 1];
            System.arraycopy(args, 0, argsPlus, 0, args.length - 1);
            argsPlus[args.length - 1] = suppressed;
            argsPlus[args.length] = args[args.length - 1];
            return argsPlus;
        }
        @Nullable
        Object[] argsPlus = new Object[args.length + 1];
        System.arraycopy(args, 0, argsPlus, 0, args.length);
        argsPlus[args.length] = suppressed;
        return argsPlus;
    }
}
