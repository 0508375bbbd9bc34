/*
 * SampleIdentity.java
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

import com.google.common.base.Preconditions;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import org.samplespace.SpaceProperties;
import org.samplespace.annotation.API;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Digest of the values of a sample, used as the identity field of sampled configurations.
 *
 * <p>
 * Keys are hashed in lexicographic order, each followed by the string form of its value, so the digest
 * does not depend on insertion order. A nested mapping is digested the same way and its truncated digest
 * hashed in place of the value.
 * </p>
 */
@API(API.Status.STABLE)
public final class SampleIdentity {

    private SampleIdentity() {
    }

    /**
     * Compute the identity of a sample.
     * @param sample the sample, possibly nested
     * @param size number of hexadecimal characters kept from the SHA-256 digest
     * @return the truncated hexadecimal digest
     */
    @Nonnull
    public static String compute(@Nonnull Map<?, ?> sample, int size) {
        Preconditions.checkArgument(size > 0 && size <= SpaceProperties.MAX_IDENTITY_SIZE,
                "identity size must be between 1 and %s", SpaceProperties.MAX_IDENTITY_SIZE);
        final Map<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : sample.entrySet()) {
            sorted.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        final Hasher hasher = Hashing.sha256().newHasher();
        for (Map.Entry<String, Object> entry : sorted.entrySet()) {
            hasher.putString(entry.getKey(), StandardCharsets.UTF_8);
            if (entry.getValue() instanceof Map) {
                hasher.putString(compute((Map<?, ?>) entry.getValue(), size), StandardCharsets.UTF_8);
            } else {
                hasher.putString(String.valueOf(entry.getValue()), StandardCharsets.UTF_8);
            }
        }
        return hasher.hash().toString().substring(0, size);
    }
}
