/*
 * CompositeCondition.java
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
import java.util.Objects;

/**
 * Two conditions combined with {@code and} or {@code or}.
 */
@API(API.Status.STABLE)
public final class CompositeCondition extends Condition {
    @Nonnull
    private final CombinatorType type;
    @Nonnull
    private final Condition left;
    @Nonnull
    private final Condition right;

    CompositeCondition(@Nonnull CombinatorType type, @Nonnull Condition left, @Nonnull Condition right) {
        this.type = type;
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
    }

    @Nonnull
    public CombinatorType getType() {
        return type;
    }

    @Nonnull
    public Condition getLeft() {
        return left;
    }

    @Nonnull
    public Condition getRight() {
        return right;
    }

    @Override
    public <T, A> T accept(@Nonnull ConditionVisitor<T, A> visitor, @Nonnull ConditionMode mode, A target) {
        return visitor.visitComposite(mode, this, target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CompositeCondition that = (CompositeCondition) o;
        return type == that.type && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, left, right);
    }

    @Override
    public String toString() {
        return type.getFunctionName() + "(" + left + ", " + right + ")";
    }
}
