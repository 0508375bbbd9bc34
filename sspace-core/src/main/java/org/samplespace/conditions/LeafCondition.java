/*
 * LeafCondition.java
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

import com.google.common.collect.ImmutableList;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.expressions.Values;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A comparison between the value of a referenced dimension and a fixed value. For {@link ComparisonType#IN}
 * the value is a list and the condition holds when the dimension takes any of its elements.
 */
@API(API.Status.STABLE)
public final class LeafCondition extends Condition {
    @Nonnull
    private final ComparisonType type;
    @Nonnull
    private final String reference;
    @Nullable
    private final Object value;

    LeafCondition(@Nonnull ComparisonType type, @Nonnull String reference, @Nullable Object value) {
        this.type = type;
        this.reference = Objects.requireNonNull(reference);
        if (type == ComparisonType.IN) {
            if (!(value instanceof Collection)) {
                throw new SpaceCoreArgumentException("in condition requires a list of values",
                        LogMessageKeys.REFERENCE, reference);
            }
            final ImmutableList.Builder<Object> values = ImmutableList.builder();
            for (Object element : (Collection<?>) value) {
                if (element == null) {
                    throw new SpaceCoreArgumentException("in condition values must not be null",
                            LogMessageKeys.REFERENCE, reference);
                }
                values.add(Objects.requireNonNull(Values.normalize(element)));
            }
            this.value = values.build();
        } else if ((type == ComparisonType.LT || type == ComparisonType.GT) && value == null) {
            throw new SpaceCoreArgumentException("ordering conditions require a value",
                    LogMessageKeys.OPERATOR, type.getOperatorName(),
                    LogMessageKeys.REFERENCE, reference);
        } else {
            this.value = Values.normalize(value);
        }
    }

    @Nonnull
    public ComparisonType getType() {
        return type;
    }

    /**
     * The path of the referenced dimension as it was given when the condition was built.
     * @return the reference
     */
    @Nonnull
    public String getReference() {
        return reference;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    /**
     * The values of an {@link ComparisonType#IN} condition.
     * @return the list of values
     * @throws IllegalStateException if this is not an {@code in} condition
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    public List<Object> getValues() {
        if (type != ComparisonType.IN) {
            throw new IllegalStateException("only in conditions hold a list of values");
        }
        return (List<Object>) Objects.requireNonNull(value);
    }

    @Override
    public <T, A> T accept(@Nonnull ConditionVisitor<T, A> visitor, @Nonnull ConditionMode mode, A target) {
        return visitor.visitLeaf(mode, this, target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LeafCondition that = (LeafCondition) o;
        return type == that.type && reference.equals(that.reference) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, reference, value);
    }

    @Override
    public String toString() {
        return type.getOperatorName() + "(" + reference + ", " + value + ")";
    }
}
