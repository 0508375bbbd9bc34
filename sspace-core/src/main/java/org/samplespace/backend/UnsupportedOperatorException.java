/*
 * UnsupportedOperatorException.java
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

package org.samplespace.backend;

import org.samplespace.SpaceCoreException;
import org.samplespace.annotation.API;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown at compile time when a tree uses a condition operator, or a dimension feature, that the selected
 * backend cannot compile.
 */
@API(API.Status.STABLE)
public class UnsupportedOperatorException extends SpaceCoreException {
    private static final long serialVersionUID = 1;

    public UnsupportedOperatorException(@Nonnull String backend, @Nonnull String operator,
                                        @Nullable Object... keyValues) {
        super("operator not supported by this backend",
                LogMessageKeys.BACKEND, backend,
                LogMessageKeys.OPERATOR, operator);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }
}
