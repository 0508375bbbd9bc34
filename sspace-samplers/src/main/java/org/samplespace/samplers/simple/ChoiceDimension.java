/*
 * ChoiceDimension.java
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

package org.samplespace.samplers.simple;

import org.apache.commons.math3.distribution.EnumeratedDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.Pair;
import org.samplespace.annotation.API;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One of a set of values drawn with probabilities proportional to their weights.
 */
@API(API.Status.INTERNAL)
public class ChoiceDimension extends SimpleDimension {
    @Nonnull
    private final List<Pair<Object, Double>> probabilities;

    public ChoiceDimension(@Nonnull String name, @Nonnull Map<Object, Double> options) {
        this(name, toPairs(options));
    }

    private ChoiceDimension(@Nonnull String name, @Nonnull List<Pair<Object, Double>> probabilities) {
        super(name);
        this.probabilities = probabilities;
    }

    @Nonnull
    private static List<Pair<Object, Double>> toPairs(@Nonnull Map<Object, Double> options) {
        final List<Pair<Object, Double>> pairs = new ArrayList<>(options.size());
        for (Map.Entry<Object, Double> option : options.entrySet()) {
            pairs.add(new Pair<>(option.getKey(), option.getValue()));
        }
        return pairs;
    }

    @Nonnull
    @Override
    public Object sample(@Nonnull RandomGenerator random) {
        return new EnumeratedDistribution<>(random, probabilities).sample();
    }

    @Nonnull
    @Override
    public SimpleDimension withName(@Nonnull String newName) {
        return new ChoiceDimension(newName, probabilities);
    }
}
