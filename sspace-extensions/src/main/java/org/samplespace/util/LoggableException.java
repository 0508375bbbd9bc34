/*
 * LoggableException.java
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
import java.util.Map;

/**
 * Unchecked exception carrying structured key/value information alongside its message, so that failures
 * can be logged as a static title plus searchable context.
 *
 * <pre>{@code
 * throw new LoggableException("unknown constructor", "token", name, "position", offset);
 * }</pre>
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException implements LoggableKeysAndValues<LoggableException> {
    @Nonnull private final LoggableKeysAndValuesImpl loggableKeysAndValuesImpl = new LoggableKeysAndValuesImpl();

    /**
     * Create an exception with the given message and a sequence of key-value pairs.
     *
     * @param msg error message
     * @param keyValues flattened key-value pairs
     * @throws IllegalArgumentException if <code>keyValues</code> has odd length
     * @see #addLogInfo(Object...)
     */
    public LoggableException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            this.loggableKeysAndValuesImpl.addLogInfo(keyValues);
        }
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public LoggableException(@Nonnull String msg) {
        super(msg);
    }

    @Nonnull
    @Override
    public Map<String, Object> getLogInfo() {
        return loggableKeysAndValuesImpl.getLogInfo();
    }

    @Nonnull
    @Override
    public LoggableException addLogInfo(@Nonnull String description, Object object) {
        loggableKeysAndValuesImpl.addLogInfo(description, object);
        return this;
    }

    @Nonnull
    @Override
    public LoggableException addLogInfo(@Nonnull Object... keyValue) {
        loggableKeysAndValuesImpl.addLogInfo(keyValue);
        return this;
    }

    @Nonnull
    @Override
    public Object[] exportLogInfo() {
        return loggableKeysAndValuesImpl.exportLogInfo();
    }
}
