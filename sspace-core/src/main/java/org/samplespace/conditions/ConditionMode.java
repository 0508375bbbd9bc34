/*
 * ConditionMode.java
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

package org.samplespace.conditions;

import org.samplespace.annotation.API;

import javax.annotation.Nonnull;

/**
 * The two roles a condition plays on a dimension. Backends may support a different set of operators for each.
 */
@API(API.Status.STABLE)
public enum ConditionMode {
    /**
     * The dimension is active only when the condition holds.
     */
    CONDITIONALS("conditionals"),
    /**
     * Configurations for which the condition holds are rejected.
     */
    FORBID("forbid");

    @Nonnull
    private final String key;

    ConditionMode(@Nonnull String key) {
        this.key = key;
    }

    /**
     * The attribute name under which conditions of this mode are persisted.
     * @return the persisted key
     */
    @Nonnull
    public String getKey() {
        return key;
    }
}
