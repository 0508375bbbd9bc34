/*
 * ComparisonClause.java
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
import org.samplespace.conditions.ComparisonType;
import org.samplespace.expressions.Space;
import org.samplespace.expressions.Values;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Map;

/**
 * Compares the value of one parameter with a fixed value.
 */
@API(API.Status.INTERNAL)
public class ComparisonClause implements Clause {
    @Nonnull
    private final ComparisonType type;
    @Nonnull
    private final Hyperparameter parameter;
    @Nullable
    private final Object value;

    public ComparisonClause(@Nonnull ComparisonType type, @Nonnull Hyperparameter parameter, @Nullable Object value) {
        this.type = type;
        this.parameter = parameter;
        this.value = value;
    }

    @Override
    public boolean test(@Nonnull Map<String, Object> configuration) {
        final Object actual = configuration.get(parameter.getName());
        if (actual == null) {
            return false;
        }
        switch (type) {
            case EQ:
                return Values.sameValue(actual, value);
            case NE:
                return !Values.sameValue(actual, value);
            case LT:
                return parameter.compare(actual, value) < 0;
            case GT:
                return parameter.compare(actual, value) > 0;
            case IN:
                return ((Collection<?>) value).stream().anyMatch(element -> Values.sameValue(actual, element));
            default:
                throw new IllegalStateException("unknown comparison " + type);
        }
    }

    @Nonnull
    @Override
    public Clause withPrefix(@Nonnull String prefix) {
        return new ComparisonClause(type, parameter.withName(prefix + Space.DELIMITER + parameter.getName()), value);
    }

    @Override
    public String toString() {
        return parameter.getName() + " " + type.getSymbol() + " " + value;
    }
}
