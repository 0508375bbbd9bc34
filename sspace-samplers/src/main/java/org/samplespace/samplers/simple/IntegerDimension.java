/*
 * IntegerDimension.java
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

import org.apache.commons.math3.distribution.UniformIntegerDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.samplespace.annotation.API;
import org.samplespace.expressions.Distribution;
import org.samplespace.expressions.Values;

import javax.annotation.Nonnull;

/**
 * An integer drawn uniformly between two inclusive bounds, or a log-uniform or normal value rounded.
 */
@API(API.Status.INTERNAL)
public class IntegerDimension extends RealDimension {

    public IntegerDimension(@Nonnull String name, @Nonnull Distribution distribution, double a, double b, boolean log) {
        super(name, distribution, a, b, log);
    }

    @Nonnull
    @Override
    public Object sample(@Nonnull RandomGenerator random) {
        if (getDistribution() == Distribution.UNIFORM && !isLog()) {
            return new UniformIntegerDistribution(random, (int) Math.ceil(getA()), (int) Math.floor(getB())).sample();
        }
        double value = draw(random);
        if (getDistribution() == Distribution.UNIFORM) {
            value = Math.max(getA(), Math.min(getB(), value));
        }
        return Values.normalizeNumber(Math.round(value));
    }

    @Nonnull
    @Override
    public SimpleDimension withName(@Nonnull String newName) {
        return new IntegerDimension(newName, getDistribution(), getA(), getB(), isLog());
    }
}
