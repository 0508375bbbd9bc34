/*
 * MissingVariableException.java
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

package org.samplespace;

import com.google.common.collect.ImmutableList;
import org.samplespace.annotation.API;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Thrown before any sampling happens when declared variables were not supplied. Every missing name is
 * reported, not only the first one.
 */
@API(API.Status.STABLE)
public class MissingVariableException extends SpaceCoreException {
    private static final long serialVersionUID = 1;

    @Nonnull
    private final List<String> missing;

    public MissingVariableException(@Nonnull List<String> missing) {
        super("variables are missing: " + String.join(", ", missing), LogMessageKeys.VARIABLES, missing);
        this.missing = ImmutableList.copyOf(missing);
    }

    /**
     * The full dotted names of the declared variables that were not supplied, in declaration order.
     * @return the missing variable names
     */
    @Nonnull
    public List<String> getMissing() {
        return missing;
    }
}
