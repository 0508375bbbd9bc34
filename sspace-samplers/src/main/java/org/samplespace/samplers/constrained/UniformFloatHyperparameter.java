/*
 * UniformFloatHyperparameter.java
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

import org.apache.commons.math3.distribution.UniformRealDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A real value drawn uniformly between two bounds, or uniformly in log space. Quantized values are clamped
 * back into the bounds.
 */
@API(API.Status.INTERNAL)
public class UniformFloatHyperparameter extends NumericHyperparameter {
    private final double lower;
    private final double upper;

    public UniformFloatHyperparameter(@Nonnull String name, double lower, double upper, boolean log,
                                      @Nullable Double quantization) {
        super(name, log, quantization);
        if (!(lower < upper)) {
            throw new SpaceCoreArgumentException("lower bound must be below upper bound",
                    LogMessageKeys.DIMENSION, name,
                    "lower", lower,
                    "upper", upper);
        }
        if (log && !(lower > 0.0)) {
            throw new SpaceCoreArgumentException("log scale requires a positive lower bound",
                    LogMessageKeys.DIMENSION, name,
                    "lower", lower);
        }
        this.lower = lower;
        this.upper = upper;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    /**
     * Draw a real number in the bounds, before quantization.
     * @param random the generator
     * @return the drawn number
     */
    protected double draw(@Nonnull RandomGenerator random) {
        if (isLog()) {
            return Math.exp(new UniformRealDistribution(random, Math.log(lower), Math.log(upper)).sample());
        }
        return new UniformRealDistribution(random, lower, upper).sample();
    }

    @Nonnull
    @Override
    public Object sample(@Nonnull RandomGenerator random, long position) {
        return clamp(quantize(draw(random)));
    }

    protected double clamp(double value) {
        return Math.max(lower, Math.min(upper, value));
    }

    @Nonnull
    @Override
    public Hyperparameter withName(@Nonnull String newName) {
        return new UniformFloatHyperparameter(newName, lower, upper, isLog(), getQuantization());
    }

    @Override
    public boolean isLegal(@Nullable Object value) {
        return super.isLegal(value) && ((Number) value).doubleValue() >= lower && ((Number) value).doubleValue() <= upper;
    }
}
