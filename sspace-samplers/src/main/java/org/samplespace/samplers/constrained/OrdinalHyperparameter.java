/*
 * OrdinalHyperparameter.java
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

import com.google.common.collect.ImmutableList;
import org.apache.commons.math3.random.RandomGenerator;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.expressions.Values;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * A value walked from an ordered sequence rather than drawn: the configuration at position {@code p} takes
 * {@code sequence[p mod length]}. Values are ordered by their index in the sequence.
 */
@API(API.Status.INTERNAL)
public class OrdinalHyperparameter extends Hyperparameter {
    @Nonnull
    private final List<Object> sequence;

    public OrdinalHyperparameter(@Nonnull String name, @Nonnull List<?> sequence) {
        super(name);
        if (sequence.isEmpty()) {
            throw new SpaceCoreArgumentException("ordinal needs at least one value", LogMessageKeys.DIMENSION, name);
        }
        this.sequence = ImmutableList.copyOf(sequence);
    }

    @Nonnull
    public List<Object> getSequence() {
        return sequence;
    }

    @Nonnull
    @Override
    public Object sample(@Nonnull RandomGenerator random, long position) {
        return sequence.get((int) Math.floorMod(position, (long) sequence.size()));
    }

    @Nonnull
    @Override
    public Hyperparameter withName(@Nonnull String newName) {
        return new OrdinalHyperparameter(newName, sequence);
    }

    @Override
    public boolean isLegal(@Nullable Object value) {
        return indexOf(value) >= 0;
    }

    @Override
    public int compare(@Nonnull Object left, @Nonnull Object right) {
        return Integer.compare(indexOf(left), indexOf(right));
    }

    private int indexOf(@Nullable Object value) {
        for (int i = 0; i < sequence.size(); i++) {
            if (Values.sameValue(sequence.get(i), value)) {
                return i;
            }
        }
        return -1;
    }
}
