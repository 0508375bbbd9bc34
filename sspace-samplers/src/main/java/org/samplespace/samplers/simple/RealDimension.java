/*
 * RealDimension.java
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

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.UniformRealDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.expressions.Distribution;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * A real value drawn uniformly, log-uniformly or from a normal distribution.
 */
@API(API.Status.INTERNAL)
public class RealDimension extends SimpleDimension {
    @Nonnull
    private final Distribution distribution;
    private final double a;
    private final double b;
    private final boolean log;

    public RealDimension(@Nonnull String name, @Nonnull Distribution distribution, double a, double b, boolean log) {
        super(name);
        if (distribution == Distribution.UNIFORM && !(a < b)) {
            throw new SpaceCoreArgumentException("lower bound must be below upper bound", LogMessageKeys.DIMENSION, name);
        }
        if (distribution == Distribution.UNIFORM && log && !(a > 0.0)) {
            throw new SpaceCoreArgumentException("log scale requires a positive lower bound", LogMessageKeys.DIMENSION, name);
        }
        if (distribution == Distribution.NORMAL && !(b > 0.0)) {
            throw new SpaceCoreArgumentException("scale must be positive", LogMessageKeys.DIMENSION, name);
        }
        this.distribution = distribution;
        this.a = a;
        this.b = b;
        this.log = log;
    }

    @Nonnull
    public Distribution getDistribution() {
        return distribution;
    }

    public double getA() {
        return a;
    }

    public double getB() {
        return b;
    }

    public boolean isLog() {
        return log;
    }

    protected double draw(@Nonnull RandomGenerator random) {
        if (distribution == Distribution.NORMAL) {
            return new NormalDistribution(random, a, b).sample();
        }
        if (log) {
            return Math.exp(new UniformRealDistribution(random, Math.log(a), Math.log(b)).sample());
        }
        return new UniformRealDistribution(random, a, b).sample();
    }

    @Nonnull
    @Override
    public Object sample(@Nonnull RandomGenerator random) {
        return draw(random);
    }

    @Nonnull
    @Override
    public SimpleDimension withName(@Nonnull String newName) {
        return new RealDimension(newName, distribution, a, b, log);
    }
}
