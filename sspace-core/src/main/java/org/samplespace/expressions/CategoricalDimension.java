/*
 * CategoricalDimension.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A dimension taking one of a fixed set of values, each with a relative weight. Weights need not sum to one.
 */
@API(API.Status.STABLE)
public final class CategoricalDimension extends Dimension {
    @Nonnull
    private final ImmutableMap<Object, Double> options;

    CategoricalDimension(@Nonnull String name, @Nullable Space space, @Nonnull Map<?, ? extends Number> options) {
        super(name, space);
        if (options.isEmpty()) {
            throw new SpaceCoreArgumentException("categorical dimension needs at least one option",
                    LogMessageKeys.DIMENSION, name);
        }
        ImmutableMap.Builder<Object, Double> builder = ImmutableMap.builderWithExpectedSize(options.size());
        for (Map.Entry<?, ? extends Number> option : options.entrySet()) {
            if (option.getKey() == null || option.getValue() == null || option.getValue().doubleValue() < 0.0) {
                throw new SpaceCoreArgumentException("categorical options need a value and a non-negative weight",
                        LogMessageKeys.DIMENSION, name,
                        "option", option.getKey());
            }
            builder.put(Objects.requireNonNull(Values.normalize(option.getKey())), option.getValue().doubleValue());
        }
        this.options = builder.buildOrThrow();
    }

    /**
     * Weights giving every value the same probability, as used when only the values are given.
     * @param name the name of the dimension being built
     * @param values the values
     * @return the values mapped to {@code 1 / values.size()}
     */
    @Nonnull
    static Map<Object, Double> equalWeights(@Nonnull String name, @Nonnull List<?> values) {
        Map<Object, Double> weights = new LinkedHashMap<>();
        for (Object value : values) {
            if (weights.put(Values.normalize(value), 1.0 / values.size()) != null) {
                throw new SpaceCoreArgumentException("categorical values must be distinct",
                        LogMessageKeys.DIMENSION, name,
                        "option", value);
            }
        }
        return weights;
    }

    /**
     * The values mapped to their weights, in declaration order.
     * @return the options
     */
    @Nonnull
    public Map<Object, Double> getOptions() {
        return options;
    }

    @Nonnull
    public List<Object> getChoices() {
        return options.keySet().asList();
    }

    @Nonnull
    public List<Double> getWeights() {
        return ImmutableList.copyOf(options.values());
    }

    /**
     * Whether every weight is the default {@code 1 / n} given to a plain list of values.
     * @return whether the weights are the equal default ones
     */
    public boolean hasEqualWeights() {
        final double expected = 1.0 / options.size();
        return options.values().stream().allMatch(weight -> weight == expected);
    }

    @Override
    public <T> T accept(@Nonnull DimensionVisitor<T> visitor) {
        return visitor.visitCategorical(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CategoricalDimension that = (CategoricalDimension) o;
        return getName().equals(that.getName())
                && options.equals(that.options)
                && ImmutableList.copyOf(options.keySet()).equals(ImmutableList.copyOf(that.options.keySet()))
                && sameDecorations(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getName(), options);
    }

    @Override
    public String toString() {
        return "choices(" + getName() + ", "
                + options.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining(", "))
                + decorationsToString() + ")";
    }
}
