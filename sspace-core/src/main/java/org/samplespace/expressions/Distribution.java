/*
 * Distribution.java
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

import org.samplespace.annotation.API;

import javax.annotation.Nonnull;

/**
 * The family of a {@link ContinuousDimension}, which decides how its two parameters are read.
 */
@API(API.Status.STABLE)
public enum Distribution {
    /**
     * Parameters are the lower and upper bounds.
     */
    UNIFORM("uniform", "lower", "upper"),
    /**
     * Parameters are the location (mean) and the scale (standard deviation).
     */
    NORMAL("normal", "loc", "scale");

    @Nonnull
    private final String kind;
    @Nonnull
    private final String firstParameter;
    @Nonnull
    private final String secondParameter;

    Distribution(@Nonnull String kind, @Nonnull String firstParameter, @Nonnull String secondParameter) {
        this.kind = kind;
        this.firstParameter = firstParameter;
        this.secondParameter = secondParameter;
    }

    /**
     * The kind tag used by both persisted forms, {@code uniform} or {@code normal}.
     * @return the kind tag
     */
    @Nonnull
    public String getKind() {
        return kind;
    }

    /**
     * The kind tag of the log-transformed variant, {@code loguniform} or {@code lognormal}.
     * @return the log kind tag
     */
    @Nonnull
    public String getLogKind() {
        return "log" + kind;
    }

    @Nonnull
    public String getFirstParameter() {
        return firstParameter;
    }

    @Nonnull
    public String getSecondParameter() {
        return secondParameter;
    }
}
