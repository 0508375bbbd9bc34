/*
 * ConditionVisitor.java
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
 * Double dispatch over {@link LeafCondition} and {@link CompositeCondition}.
 *
 * @param <T> the result of visiting one condition
 * @param <A> a value threaded through the visit
 */
@API(API.Status.STABLE)
public interface ConditionVisitor<T, A> {

    T visitLeaf(@Nonnull ConditionMode mode, @Nonnull LeafCondition leaf, A target);

    T visitComposite(@Nonnull ConditionMode mode, @Nonnull CompositeCondition composite, A target);
}
