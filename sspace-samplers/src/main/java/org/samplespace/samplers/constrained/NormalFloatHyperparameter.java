/*
 * NormalFloatHyperparameter.java
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

import org.apache.commons.math3.distribution.LogNormalDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A real value drawn from a normal distribution, or from a log-normal one whose logarithm has the given
 * mean and standard deviation.
 */
@API(API.Status.INTERNAL)
public class NormalFloatHyperparameter extends NumericHyperparameter {
    private final double loc;
    private final double scale;

    public NormalFloatHyperparameter(@Nonnull String name, double loc, double scale, boolean log,
                                     @Nullable Double quantization) {
        super(name, log, quantization);
        if (!(scale > 0.0)) {
            throw new SpaceCoreArgumentException("scale must be positive",
                    LogMessageKeys.DIMENSION, name,
                    "scale", scale);
        }
        this.loc = loc;
        this.scale = scale;
    }

    public double getLoc() {
        return loc;
    }

    public double getScale() {
        return scale;
    }

    protected double draw(@Nonnull RandomGenerator random) {
        if (isLog()) {
            return new LogNormalDistribution(random, loc, scale).sample();
        }
        return new NormalDistribution(random, loc, scale).sample();
    }

    @Nonnull
    @Override
    public Object sample(@Nonnull RandomGenerator random, long position) {
        return quantize(draw(random));
    }

    @Nonnull
    @Override
    public Hyperparameter withName(@Nonnull String newName) {
        return new NormalFloatHyperparameter(newName, loc, scale, isLog(), getQuantization());
    }
}
