/*
 * DimensionVisitor.java
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

package org.samplespace.expressions;

import org.samplespace.annotation.API;

import javax.annotation.Nonnull;

/**
 * Double dispatch over the closed set of {@link Dimension} kinds. Every compiler, serializer and renderer
 * implements one method per kind, so adding a kind is a compile error in each of them rather than a
 * runtime "unknown kind" failure.
 *
 * @param <T> the result of visiting one dimension
 */
@API(API.Status.STABLE)
public interface DimensionVisitor<T> {

    T visitContinuous(@Nonnull ContinuousDimension dimension);

    T visitCategorical(@Nonnull CategoricalDimension dimension);

    T visitOrdinal(@Nonnull OrdinalDimension dimension);

    T visitVariable(@Nonnull VariableDimension dimension);

    T visitSpace(@Nonnull Space space);
}
