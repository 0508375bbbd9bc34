/*
 * SimpleSpace.java
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

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.expressions.Space;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The compiled form of a space for the simple engine: independent dimensions drawn in insertion order.
 */
@API(API.Status.INTERNAL)
public class SimpleSpace {
    @Nonnull
    private final Map<String, SimpleDimension> dimensions = new LinkedHashMap<>();

    public void register(@Nonnull SimpleDimension dimension) {
        if (dimensions.putIfAbsent(dimension.getName(), dimension) != null) {
            throw new SpaceCoreArgumentException("dimension already exists", LogMessageKeys.DIMENSION, dimension.getName());
        }
    }

    @Nonnull
    public Map<String, SimpleDimension> mount(@Nonnull String prefix, @Nonnull SimpleSpace nested) {
        final Map<String, SimpleDimension> mounted = new LinkedHashMap<>();
        for (SimpleDimension dimension : nested.dimensions.values()) {
            final SimpleDimension renamed = dimension.withName(prefix + Space.DELIMITER + dimension.getName());
            register(renamed);
            mounted.put(renamed.getName(), renamed);
        }
        return mounted;
    }

    @Nonnull
    public Map<String, SimpleDimension> getDimensions() {
        return Collections.unmodifiableMap(dimensions);
    }

    @Nonnull
    public List<Map<String, Object>> sample(int count, long seed) {
        final RandomGenerator random = new MersenneTwister(seed);
        final List<Map<String, Object>> samples = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final Map<String, Object> sample = new TreeMap<>();
            for (SimpleDimension dimension : dimensions.values()) {
                sample.put(dimension.getName(), dimension.sample(random));
            }
            samples.add(sample);
        }
        return samples;
    }
}
