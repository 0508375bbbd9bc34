/*
 * DimensionConstructor.java
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

package org.samplespace.serialization;

import org.samplespace.annotation.API;
import org.samplespace.expressions.Dimension;
import org.samplespace.expressions.Space;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Adds one dimension to a space from named or positional arguments. Both persisted forms rebuild dimensions
 * through these.
 */
@API(API.Status.INTERNAL)
@FunctionalInterface
public interface DimensionConstructor {

    /**
     * Add a dimension.
     * @param target the space receiving the dimension
     * @param name the name of the dimension
     * @param arguments the arguments of the call
     * @return the new dimension, or {@code null} for a directive such as {@code identity} that adds none
     */
    @Nullable
    Dimension construct(@Nonnull Space target, @Nonnull String name, @Nonnull ConstructorArguments arguments);
}
