/*
 * SimpleSpaceBackendTest.java
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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.samplespace.backend.UnsupportedOperatorException;
import org.samplespace.expressions.CategoricalDimension;
import org.samplespace.expressions.Space;
import org.samplespace.test.RandomSeedSource;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.oneOf;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SimpleSpaceBackend}.
 */
public class SimpleSpaceBackendTest {

    private static Space simpleSpace() {
        Space space = new Space(SimpleSpaceBackend.NAME);
        space.uniform("a", -1, 1);
        space.loguniform("lr", 1e-3, 1);
        space.uniform("units", 8, 64, true, false, null);
        space.normal("noise", 0, 2);
        space.categorical("model.kind", List.of("mlp", "cnn"));
        return space;
    }

    @Test
    @SuppressWarnings("unchecked")
    public void samplesIndependentDimensions() {
        for (Map<String, Object> sample : simpleSpace().sample(50, 4)) {
            assertThat(sample.keySet(), contains("a", "lr", "model", "noise", "units"));
            assertThat((Double) sample.get("a"), allOf(greaterThanOrEqualTo(-1.0), lessThanOrEqualTo(1.0)));
            assertThat((Double) sample.get("lr"), allOf(greaterThanOrEqualTo(1e-3), lessThanOrEqualTo(1.0)));
            assertThat(sample.get("units"), instanceOf(Integer.class));
            assertThat((Integer) sample.get("units"), allOf(greaterThanOrEqualTo(8), lessThanOrEqualTo(64)));
            assertThat(((Map<String, Object>) sample.get("model")).get("kind"), oneOf("mlp", "cnn"));
        }
    }

    @ParameterizedTest
    @RandomSeedSource
    public void samplingIsDeterministic(long seed) {
        assertEquals(simpleSpace().sample(10, seed), simpleSpace().sample(10, seed));
    }

    @Test
    public void forbiddenClauseFailsBeforeSampling() {
        Space space = new Space(SimpleSpaceBackend.NAME);
        space.categorical("kind", List.of("a", "b")).forbidEqual("a");
        UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class, () -> space.sample(1));
        assertEquals(SimpleSpaceBackend.NAME, e.getLogInfo().get("backend"));
        assertEquals("eq", e.getLogInfo().get("operator"));
        assertEquals("forbid", e.getLogInfo().get("mode"));
        assertFalse(space.isInstantiated());
    }

    @Test
    public void conditionsAreUnsupported() {
        assertUnsupported("eq", space -> {
            CategoricalDimension kind = space.categorical("kind", List.of("a", "b"));
            space.uniform("x", 0, 1).enableIf(kind.eq("a"));
        });
    }

    @Test
    public void unsupportedDimensionFeatures() {
        assertUnsupported("ordinal", space -> space.ordinal("o", 1, 2, 3));
        assertUnsupported("quantization", space -> space.uniform("q", 0, 1, false, false, 0.1));
        assertUnsupported("lognormal", space -> space.lognormal("l", 0, 1));
    }

    private static void assertUnsupported(String operator, Consumer<Space> builder) {
        Space space = new Space(SimpleSpaceBackend.NAME);
        builder.accept(space);
        UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class, space::instantiate);
        assertEquals(operator, e.getLogInfo().get("operator"));
    }
}
