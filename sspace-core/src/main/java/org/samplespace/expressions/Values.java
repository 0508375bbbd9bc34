/*
 * Values.java
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

import javax.annotation.Nullable;
import java.math.BigInteger;

/**
 * Normalization of the scalar values held by dimensions and conditions. Integral numbers become
 * {@link Integer} when they fit and {@link Long} otherwise; other numbers become {@link Double}. Values read
 * back from either persisted form then compare equal to the values they were written from.
 */
@API(API.Status.INTERNAL)
public final class Values {

    private Values() {
    }

    @Nullable
    public static Object normalize(@Nullable Object value) {
        if (value instanceof Number) {
            return normalizeNumber((Number) value);
        }
        return value;
    }

    @Nullable
    public static Number normalizeNumber(@Nullable Number value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return value.intValue();
        }
        if (value instanceof Long || value instanceof BigInteger) {
            long asLong = value.longValue();
            if (asLong >= Integer.MIN_VALUE && asLong <= Integer.MAX_VALUE) {
                return (int) asLong;
            }
            return asLong;
        }
        return value.doubleValue();
    }

    /**
     * Compare two values numerically when both are numbers, and with {@link Object#equals(Object)} otherwise.
     * @param left first value
     * @param right second value
     * @return whether the two values are the same
     */
    public static boolean sameValue(@Nullable Object left, @Nullable Object right) {
        if (left instanceof Number && right instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue()) == 0;
        }
        return left == null ? right == null : left.equals(right);
    }
}
