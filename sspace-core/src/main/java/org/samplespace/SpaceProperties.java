/*
 * SpaceProperties.java
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

package org.samplespace;

import com.google.common.base.Preconditions;
import org.samplespace.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Defaults applied to a {@link org.samplespace.expressions.Space} when the caller does not give them
 * explicitly: the backend a root space compiles with and the digest length of the identity field.
 *
 * <pre>{@code
 * SpaceProperties properties = SpaceProperties.newBuilder().setBackend("simple").build();
 * Space space = new Space(properties);
 * }</pre>
 */
@API(API.Status.UNSTABLE)
public final class SpaceProperties {
    /**
     * Name of the backend used when none is configured.
     */
    public static final String DEFAULT_BACKEND = "constrained";
    /**
     * Number of hexadecimal characters kept from the identity digest when none is configured.
     */
    public static final int DEFAULT_IDENTITY_SIZE = 16;
    /**
     * Largest identity size, the length of a hexadecimal SHA-256 digest.
     */
    public static final int MAX_IDENTITY_SIZE = 64;
    /**
     * Delimiter between the segments of a dotted dimension path.
     */
    public static final String DELIMITER = ".";

    public static final SpaceProperties DEFAULT = newBuilder().build();

    @Nonnull
    private final String backend;
    private final int identitySize;

    private SpaceProperties(@Nonnull String backend, int identitySize) {
        this.backend = backend;
        this.identitySize = identitySize;
    }

    @Nonnull
    public String getBackend() {
        return backend;
    }

    public int getIdentitySize() {
        return identitySize;
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder().setBackend(backend).setIdentitySize(identitySize);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SpaceProperties that = (SpaceProperties) o;
        return identitySize == that.identitySize && backend.equals(that.backend);
    }

    @Override
    public int hashCode() {
        return Objects.hash(backend, identitySize);
    }

    @Override
    public String toString() {
        return "SpaceProperties(backend=" + backend + ", identitySize=" + identitySize + ")";
    }

    /**
     * A builder for {@link SpaceProperties}.
     */
    public static final class Builder {
        @Nonnull
        private String backend = DEFAULT_BACKEND;
        private int identitySize = DEFAULT_IDENTITY_SIZE;

        private Builder() {
        }

        @Nonnull
        public Builder setBackend(@Nonnull String backend) {
            this.backend = Objects.requireNonNull(backend);
            return this;
        }

        @Nonnull
        public Builder setIdentitySize(int identitySize) {
            Preconditions.checkArgument(identitySize > 0 && identitySize <= MAX_IDENTITY_SIZE,
                    "identity size must be between 1 and %s", MAX_IDENTITY_SIZE);
            this.identitySize = identitySize;
            return this;
        }

        @Nonnull
        public SpaceProperties build() {
            return new SpaceProperties(backend, identitySize);
        }
    }
}
