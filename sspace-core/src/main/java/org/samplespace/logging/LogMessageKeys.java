/*
 * LogMessageKeys.java
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

package org.samplespace.logging;

import org.samplespace.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by Sample Space.
 * All keys are collected here so that collisions and spelling stay consistent across modules.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    TITLE("ttl"),
    // space tree
    SPACE,
    DIMENSION,
    KIND,
    PATH,
    DIMENSION_COUNT,
    VARIABLES,
    IDENTITY,
    // conditions
    MODE,
    OPERATOR,
    REFERENCE,
    SCOPE,
    // backends and sampling
    BACKEND,
    AVAILABLE_BACKENDS,
    SAMPLE_COUNT,
    SEED,
    ATTEMPTS,
    // compact notation
    TEXT,
    TOKEN,
    POSITION,
    CONSTRUCTOR,
    // persistence
    FILE_NAME;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
