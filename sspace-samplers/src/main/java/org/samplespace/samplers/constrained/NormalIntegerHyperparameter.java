/*
 * NormalIntegerHyperparameter.java
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

import org.apache.commons.math3.random.RandomGenerator;
import org.samplespace.annotation.API;
import org.samplespace.expressions.Values;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A normally distributed value rounded to an integer.
 */
@API(API.Status.INTERNAL)
public class NormalIntegerHyperparameter extends NormalFloatHyperparameter {

    public NormalIntegerHyperparameter(@Nonnull String name, double loc, double scale, boolean log,
                                       @Nullable Double quantization) {
        super(name, loc, scale, log, quantization);
    }

    @Nonnull
    @Override
    public Object sample(@Nonnull RandomGenerator random, long position) {
        return Values.normalizeNumber(Math.round(quantize(draw(random))));
    }

    @Nonnull
    @Override
    public Hyperparameter withName(@Nonnull String newName) {
        return new NormalIntegerHyperparameter(newName, getLoc(), getScale(), isLog(), getQuantization());
    }
}
