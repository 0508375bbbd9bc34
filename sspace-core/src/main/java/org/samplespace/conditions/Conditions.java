/*
 * Conditions.java
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
import org.samplespace.expressions.Dimension;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;

/**
 * Static factories for {@link Condition}s.
 *
 * <pre>{@code
 * lr.enableIf(Conditions.either(optimizer.eq("sgd"), optimizer.eq("adam")));
 * lr.forbid(Conditions.eq("optimizer.lr", 1));
 * }</pre>
 *
 * Conditions built from a {@link Dimension} refer to its dotted path at the time of the call.
 */
@API(API.Status.STABLE)
public class Conditions {

    @Nonnull
    public static LeafCondition eq(@Nonnull Dimension dimension, @Nullable Object value) {
        return eq(dimension.getPath(), value);
    }

    @Nonnull
    public static LeafCondition eq(@Nonnull String reference, @Nullable Object value) {
        return new LeafCondition(ComparisonType.EQ, reference, value);
    }

    @Nonnull
    public static LeafCondition ne(@Nonnull Dimension dimension, @Nullable Object value) {
        return ne(dimension.getPath(), value);
    }

    @Nonnull
    public static LeafCondition ne(@Nonnull String reference, @Nullable Object value) {
        return new LeafCondition(ComparisonType.NE, reference, value);
    }

    @Nonnull
    public static LeafCondition lt(@Nonnull Dimension dimension, @Nonnull Object value) {
        return lt(dimension.getPath(), value);
    }

    @Nonnull
    public static LeafCondition lt(@Nonnull String reference, @Nonnull Object value) {
        return new LeafCondition(ComparisonType.LT, reference, value);
    }

    @Nonnull
    public static LeafCondition gt(@Nonnull Dimension dimension, @Nonnull Object value) {
        return gt(dimension.getPath(), value);
    }

    @Nonnull
    public static LeafCondition gt(@Nonnull String reference, @Nonnull Object value) {
        return new LeafCondition(ComparisonType.GT, reference, value);
    }

    @Nonnull
    public static LeafCondition contains(@Nonnull Dimension dimension, @Nonnull Collection<?> values) {
        return contains(dimension.getPath(), values);
    }

    @Nonnull
    public static LeafCondition contains(@Nonnull String reference, @Nonnull Collection<?> values) {
        return new LeafCondition(ComparisonType.IN, reference, values);
    }

    @Nonnull
    public static CompositeCondition both(@Nonnull Condition left, @Nonnull Condition right) {
        return new CompositeCondition(CombinatorType.AND, left, right);
    }

    @Nonnull
    public static CompositeCondition either(@Nonnull Condition left, @Nonnull Condition right) {
        return new CompositeCondition(CombinatorType.OR, left, right);
    }

    /**
     * Build a leaf condition from its persisted operator name.
     * @param operator {@code eq}, {@code ne}, {@code lt}, {@code gt}, {@code in} or {@code contains}
     * @param reference path of the referenced dimension
     * @param value the compared value
     * @return the condition
     * @throws org.samplespace.SpaceCoreArgumentException if the operator is unknown
     */
    @Nonnull
    public static LeafCondition leaf(@Nonnull String operator, @Nonnull String reference, @Nullable Object value) {
        return new LeafCondition(ComparisonType.fromOperatorName(operator), reference, value);
    }

    /**
     * Build a composite condition from its persisted operator name.
     * @param operator {@code and}, {@code both}, {@code or} or {@code either}
     * @param left first operand
     * @param right second operand
     * @return the condition
     * @throws org.samplespace.SpaceCoreArgumentException if the operator is unknown
     */
    @Nonnull
    public static CompositeCondition combine(@Nonnull String operator, @Nonnull Condition left, @Nonnull Condition right) {
        return new CompositeCondition(CombinatorType.fromOperatorName(operator), left, right);
    }

    private Conditions() {
    }
}
