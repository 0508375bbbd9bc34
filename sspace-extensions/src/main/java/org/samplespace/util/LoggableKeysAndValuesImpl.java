/*
 * LoggableKeysAndValuesImpl.java
 *
 * This source file is part of the Sample Space open source project
 *
 * Copyright 2020-2026 Sample Space project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.samplespace.util;

import org.samplespace.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default implementation of {@link LoggableKeysAndValues}. Keys keep the order in which they were added.
 */
@API(API.Status.INTERNAL)
public final class LoggableKeysAndValuesImpl implements LoggableKeysAndValues<LoggableKeysAndValuesImpl> {
    private static final Object[] EMPTY_LOG_INFO = new Object[0];
    @Nullable private Map<String, Object> logInfo;

    /**
     * Create an instance holding the given key-value pairs.
     *
     * @param keyValues flattened key-value pairs
     * @throws IllegalArgumentException if <code>keyValues</code> has odd length
     */
    public LoggableKeysAndValuesImpl(@Nullable Object... keyValues) {
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    @Nonnull
    @Override
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    @Nonnull
    @Override
    public LoggableKeysAndValuesImpl addLogInfo(@Nonnull String description, Object object) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, object);
        return this;
    }

    @Nonnull
    @Override
    public LoggableKeysAndValuesImpl addLogInfo(@Nonnull Object... keyValue) {
        if ((keyValue.length % 2) != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValue.length; i += 2) {
            addLogInfo(String.valueOf(keyValue[i]), keyValue[i + 1]);
        }
        return this;
    }

    @Nonnull
    @Override
    public Object[] exportLogInfo() {
        if (logInfo == null) {
            return EMPTY_LOG_INFO;
        }
        Object[] exportedInfo = new Object[2 * logInfo.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            exportedInfo[i] = entry.getKey();
            exportedInfo[i + 1] = entry.getValue();
            i += 2;
        }
        return exportedInfo;
    }
}
