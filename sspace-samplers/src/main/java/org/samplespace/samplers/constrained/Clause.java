/*
 * Clause.java
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

package org.samplespace.samplers.constrained;

import org.samplespace.annotation.API;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * A compiled condition, evaluated against the active values of a configuration.
 */
@API(API.Status.INTERNAL)
public interface Clause {

    /**
     * Evaluate the clause. A comparison against a parameter that is inactive, and so absent, is false.
     * @param configuration the active values by parameter name
     * @return whether the clause holds
     */
    boolean test(@Nonnull Map<String, Object> configuration);

    /**
     * A copy of this clause whose parameter names are prefixed, used when mounting a nested space.
     * @param prefix the prefix, without the delimiter
     * @return the renamed clause
     */
    @Nonnull
    Clause withPrefix(@Nonnull String prefix);
}
