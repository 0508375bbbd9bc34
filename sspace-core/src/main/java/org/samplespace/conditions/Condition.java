/*
 * Condition.java
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
 * A boolean expression over the values of dimensions, used both to enable a dimension and to forbid
 * configurations. Leaves compare one referenced dimension against a value; composites combine two
 * conditions.
 *
 * <p>
 * A condition names the dimensions it refers to by path and holds no reference to the tree, so the same
 * condition can be persisted and read back. Build conditions with {@link Conditions} or the comparison
 * methods of {@link org.samplespace.expressions.Dimension}.
 * </p>
 */
@API(API.Status.STABLE)
public abstract class Condition {

    Condition() {
    }

    /**
     * Dispatch to the visitor method for this kind of condition.
     * @param visitor the visitor
     * @param mode whether the condition is compiled as an enablement condition or as a forbidden clause
     * @param target value threaded through the visit, typically the dimension carrying the condition
     * @param <T> the result of the visit
     * @param <A> the type of the threaded value
     * @return the result of the visit
     */
    public abstract <T, A> T accept(@Nonnull ConditionVisitor<T, A> visitor, @Nonnull ConditionMode mode, A target);
}
