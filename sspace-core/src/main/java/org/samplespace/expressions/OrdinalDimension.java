/*
 * OrdinalDimension.java
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

import com.google.common.collect.ImmutableList;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * A dimension walking an ordered sequence of values. Samples are not independent draws: engines pick the
 * element at a position derived from the seed and the sample index, so increasing seeds walk the sequence.
 */
@API(API.Status.STABLE)
public final class OrdinalDimension extends Dimension {
    @Nonnull
    private final ImmutableList<Object> sequence;

    OrdinalDimension(@Nonnull String name, @Nullable Space space, @Nonnull List<?> sequence) {
        super(name, space);
        if (sequence.isEmpty()) {
            throw new SpaceCoreArgumentException("ordinal dimension needs at least one value",
                    LogMessageKeys.DIMENSION, name);
        }
        ImmutableList.Builder<Object> builder = ImmutableList.builderWithExpectedSize(sequence.size());
        for (Object value : sequence) {
            if (value == null) {
                throw new SpaceCoreArgumentException("ordinal values cannot be null", LogMessageKeys.DIMENSION, name);
            }
            builder.add(Objects.requireNonNull(Values.normalize(value)));
        }
        this.sequence = builder.build();
    }

    @Nonnull
    public List<Object> getSequence() {
        return sequence;
    }

    @Override
    public <T> T accept(@Nonnull DimensionVisitor<T> visitor) {
        return visitor.visitOrdinal(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        OrdinalDimension that = (OrdinalDimension) o;
        return getName().equals(that.getName()) && sequence.equals(that.sequence) && sameDecorations(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getName(), sequence);
    }

    @Override
    public String toString() {
        return "ordinal(" + getName() + ", " + sequence + decorationsToString() + ")";
    }
}
