/*
 * ContinuousDimension.java
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

import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A numeric dimension drawn from a uniform or normal {@link Distribution}, optionally log-transformed,
 * integer valued or rounded to a quantization step.
 *
 * <p>
 * The two parameters are the bounds for {@link Distribution#UNIFORM} and the location and scale for
 * {@link Distribution#NORMAL}; {@link #getLower()}/{@link #getUpper()} and {@link #getLoc()}/{@link #getScale()}
 * read the same two fields.
 * </p>
 */
@API(API.Status.STABLE)
public final class ContinuousDimension extends Dimension {
    @Nonnull
    private final Distribution distribution;
    @Nonnull
    private final Number a;
    @Nonnull
    private final Number b;
    private final boolean discrete;
    private final boolean log;
    @Nullable
    private final Number quantization;

    ContinuousDimension(@Nonnull String name, @Nullable Space space, @Nonnull Distribution distribution,
                        @Nonnull Number a, @Nonnull Number b, boolean discrete, boolean log,
                        @Nullable Number quantization) {
        super(name, space);
        this.distribution = Objects.requireNonNull(distribution);
        this.a = Values.normalizeNumber(Objects.requireNonNull(a, distribution.getFirstParameter()));
        this.b = Values.normalizeNumber(Objects.requireNonNull(b, distribution.getSecondParameter()));
        this.discrete = discrete;
        this.log = log;
        if (quantization != null && !(quantization.doubleValue() > 0.0)) {
            throw new SpaceCoreArgumentException("quantization must be positive",
                    LogMessageKeys.DIMENSION, name,
                    "quantization", quantization);
        }
        this.quantization = Values.normalizeNumber(quantization);
    }

    @Nonnull
    public Distribution getDistribution() {
        return distribution;
    }

    @Nonnull
    public Number getLower() {
        return a;
    }

    @Nonnull
    public Number getUpper() {
        return b;
    }

    @Nonnull
    public Number getLoc() {
        return a;
    }

    @Nonnull
    public Number getScale() {
        return b;
    }

    public boolean isDiscrete() {
        return discrete;
    }

    public boolean isLog() {
        return log;
    }

    @Nullable
    public Number getQuantization() {
        return quantization;
    }

    /**
     * The kind under which this dimension is written in compact notation, folding the log flag into the name.
     * @return one of {@code uniform}, {@code loguniform}, {@code normal}, {@code lognormal}
     */
    @Nonnull
    public String getCompactKind() {
        return log ? distribution.getLogKind() : distribution.getKind();
    }

    @Override
    public <T> T accept(@Nonnull DimensionVisitor<T> visitor) {
        return visitor.visitContinuous(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ContinuousDimension that = (ContinuousDimension) o;
        return getName().equals(that.getName())
                && distribution == that.distribution
                && a.equals(that.a)
                && b.equals(that.b)
                && discrete == that.discrete
                && log == that.log
                && Objects.equals(quantization, that.quantization)
                && sameDecorations(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getName(), distribution, a, b, discrete, log, quantization);
    }

    @Override
    public String toString() {
        return getCompactKind() + "(" + getName()
                + ", " + distribution.getFirstParameter() + "=" + a
                + ", " + distribution.getSecondParameter() + "=" + b
                + ", discrete=" + discrete
                + (quantization == null ? "" : ", q=" + quantization)
                + decorationsToString() + ")";
    }
}
