/*
 * NumericHyperparameter.java
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

import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;

/**
 * Shared behavior of the number valued parameters: log transform and quantization.
 */
@API(API.Status.INTERNAL)
public abstract class NumericHyperparameter extends Hyperparameter {
    private final boolean log;
    @Nullable
    private final Double quantization;

    protected NumericHyperparameter(@Nonnull String name, boolean log, @Nullable Double quantization) {
        super(name);
        if (quantization != null && !(quantization > 0.0)) {
            throw new SpaceCoreArgumentException("quantization must be positive", LogMessageKeys.DIMENSION, name);
        }
        this.log = log;
        this.quantization = quantization;
    }

    public boolean isLog() {
        return log;
    }

    @Nullable
    public Double getQuantization() {
        return quantization;
    }

    /**
     * Round a value to the closest multiple of the quantization, if any. The product is computed in decimal so
     * that a step of {@code 0.01} gives {@code 1.23} rather than {@code 1.2300000000000002}.
     * @param value the value
     * @return the rounded value
     */
    protected double quantize(double value) {
        if (quantization == null) {
            return value;
        }
        return BigDecimal.valueOf(quantization).multiply(BigDecimal.valueOf(Math.round(value / quantization))).doubleValue();
    }

    @Override
    public boolean isLegal(@Nullable Object value) {
        return value instanceof Number;
    }
}
