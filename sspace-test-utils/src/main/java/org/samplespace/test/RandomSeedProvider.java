/*
 * RandomSeedProvider.java
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

package org.samplespace.test;

import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.support.AnnotationConsumer;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * Arguments provider backing {@link RandomSeedSource}.
 * The default seeds cover zero, small consecutive seeds, and both ends of the {@code long} range.
 */
public class RandomSeedProvider implements ArgumentsProvider, AnnotationConsumer<RandomSeedSource> {
    static final long[] DEFAULT_SEEDS = {0L, 1L, 2L, 42L, 0x5eedL, Long.MAX_VALUE, Long.MIN_VALUE};

    private long[] seeds = DEFAULT_SEEDS;

    @Override
    public void accept(@Nonnull RandomSeedSource source) {
        if (source.value().length > 0) {
            seeds = Arrays.copyOf(source.value(), source.value().length);
        }
    }

    @Override
    public Stream<? extends Arguments> provideArguments(ExtensionContext context) {
        return LongStream.of(seeds).mapToObj(Arguments::of);
    }
}
