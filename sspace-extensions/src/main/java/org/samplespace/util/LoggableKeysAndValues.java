/*
 * LoggableKeysAndValues.java
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

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Associates loggable information with an object as a map.
 * Log messages in this project are a static title followed by keys and values describing the
 * context, for example an unresolved condition reference logged with {@code dimension="lr"} and
 * {@code reference="optimizer"}. Keeping the title static makes every occurrence of one failure easy to
 * find, and the keys make the affected dimensions easy to extract afterwards.
 *
 * @param <T> type of object to associate loggable information with
 */
interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    /**
     * Get the log information associated with object as a map.
     *
     * @return a single map with all log information
     */
    @Nonnull
    Map<String, Object> getLogInfo();

    /**
     * Add a key/value pair to the log information.
     *
     * @param description description of the log info pair
     * @param object value of the log info pair
     * @return this object
     */
    @Nonnull
    T addLogInfo(@Nonnull String description, Object object);

    /**
     * Add a flattened list of key/value pairs, every even element being a key and every odd element the
     * value of the key before it.
     *
     * @param keyValue flattened map of key-value pairs
     * @return this object
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    T addLogInfo(@Nonnull Object... keyValue);

    /**
     * Export the log information in the flattened form accepted by {@link #addLogInfo(Object...)}.
     *
     * @return a flattened map of key-value pairs
     */
    @Nonnull
    Object[] exportLogInfo();
}
