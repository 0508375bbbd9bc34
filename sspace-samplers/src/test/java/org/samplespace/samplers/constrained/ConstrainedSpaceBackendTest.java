/*
 * ConstrainedSpaceBackendTest.java
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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.backend.UnresolvedReferenceException;
import org.samplespace.backend.UnsupportedOperatorException;
import org.samplespace.conditions.Conditions;
import org.samplespace.expressions.CategoricalDimension;
import org.samplespace.expressions.ContinuousDimension;
import org.samplespace.expressions.OrdinalDimension;
import org.samplespace.expressions.SampleIdentity;
import org.samplespace.expressions.Space;
import org.samplespace.test.RandomSeedSource;
import org.samplespace.test.Tags;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link ConstrainedSpaceBackend}.
 */
public class ConstrainedSpaceBackendTest {

    @Test
    public void conditionedLiteralDottedDimension() {
        Space space = new Space();
        CategoricalDimension optimizer = space.categorical("optimizer", List.of("sgd", "adam"));
        ContinuousDimension lr = space.loguniform("optimizer.lr", 1, 2);
        lr.enableIf(Conditions.either(optimizer.eq("adam"), optimizer.eq("sgd")));
        lr.forbidEqual(1);

        List<Map<String, Object>> samples = space.sample(2);
        assertEquals(2, samples.size());
        for (Map<String, Object> sample : samples) {
            assertThat(sample.keySet(), containsInAnyOrder("optimizer", "optimizer.lr"));
            assertThat(sample.get("optimizer"), instanceOf(String.class));
            double value = ((Number) sample.get("optimizer.lr")).doubleValue();
            assertNotEquals(1.0, value);
            assertThat(value, allOf(greaterThanOrEqualTo(1.0), lessThanOrEqualTo(2.0)));
        }
    }

    @Test
    public void ordinalWalksSequenceWithSeed() {
        Space space = new Space();
        space.ordinal("step", 1, 2, 3, 4, 5);
        List<Object> walked = List.of(0L, 1L, 2L).stream()
                .map(seed -> space.sample(1, seed).get(0).get("step"))
                .collect(Collectors.toList());
        assertEquals(List.of(1, 2, 3), walked);

        List<Object> run = space.sample(7, 3).stream().map(sample -> sample.get("step")).collect(Collectors.toList());
        assertEquals(List.of(4, 5, 1, 2, 3, 4, 5), run);
    }

    @ParameterizedTest
    @RandomSeedSource
    public void samplingIsDeterministic(long seed) {
        assertEquals(exampleSpace().sample(20, seed), exampleSpace().sample(20, seed));
    }

    @Test
    public void differentSeedsDiffer() {
        assertNotEquals(exampleSpace().sample(20, 1), exampleSpace().sample(20, 2));
    }

    @ParameterizedTest
    @RandomSeedSource({0L, 7L, 42L})
    @SuppressWarnings("unchecked")
    public void nestedConditionsDeactivateDimensions(long seed) {
        for (Map<String, Object> sample : exampleSpace().sample(50, seed)) {
            Map<String, Object> model = (Map<String, Object>) sample.get("model");
            if ("mlp".equals(model.get("kind"))) {
                assertThat(model, hasKey("dropout"));
                assertThat(model, not(hasKey("depth")));
            } else {
                assertThat(model, not(hasKey("dropout")));
                assertThat((Integer) model.get("depth"), allOf(greaterThanOrEqualTo(1), lessThanOrEqualTo(8)));
            }
            if (!model.containsKey("dropout")) {
                assertThat(sample, not(hasKey("noise")));
            }
            assertThat((Map<String, Object>) model.get("encoder"), hasKey("units"));
            assertNotEquals(4, model.get("width"));
        }
    }

    @Test
    public void variablesAndIdentityAreMerged() {
        Space space = new Space();
        space.uniform("a", 0, 1);
        space.subspace("train").variable("epoch");
        space.identity("uid", 10);

        Map<String, Object> sample = space.sample(1, 3, Map.of("train.epoch", 7)).get(0);
        assertEquals(Map.of("epoch", 7), sample.get("train"));
        Map<String, Object> flat = new LinkedHashMap<>();
        flat.put("a", sample.get("a"));
        flat.put("train.epoch", 7);
        assertEquals(SampleIdentity.compute(flat, 10), sample.get("uid"));
    }

    @Test
    public void forbiddenClausesOnlyAcceptEqualityAndConjunction() {
        Space space = new Space();
        CategoricalDimension optimizer = space.categorical("optimizer", List.of("sgd", "adam"));
        space.uniform("lr", 0, 1).forbid(optimizer.ne("sgd"));
        UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class, space::instantiate);
        assertEquals("ne", e.getLogInfo().get("operator"));

        Space other = new Space();
        CategoricalDimension kind = other.categorical("kind", List.of("a", "b"));
        other.uniform("x", 0, 1).forbid(Conditions.either(kind.eq("a"), kind.eq("b")));
        e = assertThrows(UnsupportedOperatorException.class, other::instantiate);
        assertEquals("or", e.getLogInfo().get("operator"));
    }

    @Test
    public void orderingRequiresOrderedDimension() {
        Space space = new Space();
        CategoricalDimension optimizer = space.categorical("optimizer", List.of("sgd", "adam"));
        space.uniform("lr", 0, 1).enableIf(optimizer.gt("adam"));
        assertThrows(UnsupportedOperatorException.class, space::instantiate);

        Space ordinal = new Space();
        OrdinalDimension size = ordinal.ordinal("size", "s", "m", "l");
        ordinal.uniform("lr", 0, 1).enableIf(size.gt("s"));
        for (Map<String, Object> sample : ordinal.sample(6)) {
            assertEquals(!"s".equals(sample.get("size")), sample.containsKey("lr"));
        }
    }

    @Test
    public void conditionValuesMustBeLegal() {
        Space space = new Space();
        CategoricalDimension optimizer = space.categorical("optimizer", List.of("sgd", "adam"));
        space.uniform("lr", 0, 1).enableIf(optimizer.in(List.of("sgd", "rmsprop")));
        assertThrows(SpaceCoreArgumentException.class, space::instantiate);

        Space range = new Space();
        ContinuousDimension a = range.uniform("a", 0, 1);
        range.uniform("b", 0, 1).enableIf(a.gt(2));
        assertThrows(SpaceCoreArgumentException.class, range::instantiate);
    }

    @Test
    public void unresolvedReference() {
        Space space = new Space();
        space.uniform("lr", 0, 1).enableIf(Conditions.eq("optimizer", "sgd"));
        assertThrows(UnresolvedReferenceException.class, () -> space.sample(1));
    }

    @Test
    @Tag(Tags.Statistical)
    public void weightsShapeCategoricalFrequencies() {
        Map<String, Integer> weights = new LinkedHashMap<>();
        weights.put("rare", 1);
        weights.put("common", 3);
        Space space = new Space();
        space.categorical("c", weights);
        long common = space.sample(4000, 11).stream().filter(sample -> "common".equals(sample.get("c"))).count();
        assertThat(common / 4000.0, closeTo(0.75, 0.03));
    }

    @Test
    @Tag(Tags.Statistical)
    public void quantizedAndDiscreteValues() {
        Space space = new Space();
        space.uniform("q", 0, 1, false, false, 0.25);
        space.uniform("i", 1, 3, true, false, null);
        space.loguniform("li", 1, 1000, true, null);
        for (Map<String, Object> sample : space.sample(200, 5)) {
            double q = (Double) sample.get("q");
            assertEquals(0.0, q % 0.25, 1e-12);
            assertThat((Integer) sample.get("i"), allOf(greaterThanOrEqualTo(1), lessThanOrEqualTo(3)));
            assertThat((Integer) sample.get("li"), allOf(greaterThanOrEqualTo(1), lessThanOrEqualTo(1000)));
        }
    }

    private static Space exampleSpace() {
        Space space = new Space();
        Space model = space.subspace("model");
        CategoricalDimension kind = model.categorical("kind", List.of("mlp", "cnn"));
        model.uniform("dropout", 0, 0.5).enableIf(kind.eq("mlp"));
        model.ordinal("depth", 1, 2, 4, 8).enableIf(kind.ne("mlp"));
        model.categorical("encoder.units", List.of(16, 32));
        model.categorical("width", List.of(2, 4, 8)).forbidEqual(4);
        space.normal("noise", 0, 1).enableIf(Conditions.gt("model.dropout", 0.1));
        space.lognormal("scale", 0, 0.5);
        return space;
    }
}
