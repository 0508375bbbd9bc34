/*
 * CategoricalHyperparameter.java
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

import com.google.common.collect.ImmutableList;
import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.expressions.Values;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * One of a list of values, drawn with probabilities proportional to their weights. Values have no order.
 */
@API(API.Status.INTERNAL)
public class CategoricalHyperparameter extends Hyperparameter {
    @Nonnull
    private final List<Object> choices;
    @Nonnull
    private final double[] weights;
    @Nonnull
    private final int[] indices;

    public CategoricalHyperparameter(@Nonnull String name, @Nonnull List<?> choices, @Nonnull List<Double> weights) {
        super(name);
        this.choices = ImmutableList.copyOf(choices);
        this.weights = weights.stream().mapToDouble(Double::doubleValue).toArray();
        if (this.choices.isEmpty() || this.choices.size() != this.weights.length) {
            throw new SpaceCoreArgumentException("categorical needs one weight per choice", LogMessageKeys.DIMENSION, name);
        }
        double total = 0.0;
        for (double weight : this.weights) {
            total += weight;
        }
        if (!(total > 0.0)) {
            throw new SpaceCoreArgumentException("categorical weights must not all be zero", LogMessageKeys.DIMENSION, name);
        }
        this.indices = new int[this.weights.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
    }

    @Nonnull
    public List<Object> getChoices() {
        return choices;
    }

    @Nonnull
    @Override
    public Object sample(@Nonnull RandomGenerator random, long position) {
        return choices.get(new EnumeratedIntegerDistribution(random, indices, weights).sample());
    }

    @Nonnull
    @Override
    public Hyperparameter withName(@Nonnull String newName) {
        final ImmutableList.Builder<Double> copy = ImmutableList.builder();
        for (double weight : weights) {
            copy.add(weight);
        }
        return new CategoricalHyperparameter(newName, choices, copy.build());
    }

    @Override
    public boolean isLegal(@Nullable Object value) {
        return choices.stream().anyMatch(choice -> Values.sameValue(choice, value));
    }

    @Override
    public boolean isOrdered() {
        return false;
    }
}
