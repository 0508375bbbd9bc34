/*
 * SimpleDimension.java
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

import org.apache.commons.math3.random.RandomGenerator;
import org.samplespace.annotation.API;

import javax.annotation.Nonnull;

/**
 * A dimension of a {@link SimpleSpace}.
 */
@API(API.Status.INTERNAL)
public abstract class SimpleDimension {
    @Nonnull
    private final String name;

    protected SimpleDimension(@Nonnull String name) {
        this.name = name;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public abstract Object sample(@Nonnull RandomGenerator random);

    @Nonnull
    public abstract SimpleDimension withName(@Nonnull String newName);
}
