/*
 * SpaceCompilerTest.java
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

package org.samplespace.backend;

import org.junit.jupiter.api.Test;
import org.samplespace.conditions.CombinatorType;
import org.samplespace.conditions.ComparisonType;
import org.samplespace.conditions.Conditions;
import org.samplespace.expressions.CategoricalDimension;
import org.samplespace.expressions.ContinuousDimension;
import org.samplespace.expressions.Space;

import java.util.EnumSet;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SpaceCompiler}.
 */
public class SpaceCompilerTest {

    @Test
    public void childrenAreCompiledInInsertionOrder() {
        Space space = new Space();
        space.uniform("b", 0, 1);
        space.ordinal("a", 1, 2, 3);
        space.uniform("model.lr", 0, 1);
        space.categorical("c", List.of("x", "y"));

        RecordingBackend.Handle handle = space.instantiate(new RecordingBackend());
        assertThat(handle.getEvents(), contains("parameter b", "parameter a", "model/parameter lr", "parameter c"));
    }

    @Test
    public void conditionIsAttachedAfterItsTargetIsRegistered() {
        Space space = new Space();
        CategoricalDimension optimizer = space.categorical("optimizer", List.of("sgd", "adam"));
        ContinuousDimension momentum = space.uniform("momentum", 0, 1);
        momentum.enableIf(optimizer.eq("sgd"));
        momentum.forbidEqual(0.5);

        RecordingBackend.Handle handle = space.instantiate(new RecordingBackend());
        assertThat(handle.getEvents(), contains(
                "parameter optimizer",
                "parameter momentum",
                "condition momentum eq(optimizer)",
                "forbid eq(momentum)"));
    }

    @Test
    public void conditionsResolveNestedPaths() {
        Space space = new Space();
        Space model = space.subspace("model");
        CategoricalDimension kind = model.categorical("kind", List.of("mlp", "cnn"));
        model.uniform("dropout", 0, 1).enableIf(kind.eq("mlp"));
        space.uniform("lr", 0, 1).enableIf(Conditions.either(Conditions.eq("model.kind", "cnn"), kind.eq("mlp")));

        RecordingBackend.Handle handle = space.instantiate(new RecordingBackend());
        assertThat(handle.getEvents(), contains(
                "model/parameter kind",
                "model/parameter dropout",
                "model/condition dropout eq(kind)",
                "parameter lr",
                "condition lr or(eq(model.kind), eq(model.kind))"));
    }

    @Test
    public void conditionOnLaterDimensionIsUnresolved() {
        Space space = new Space();
        ContinuousDimension lr = space.uniform("lr", 0, 1);
        CategoricalDimension optimizer = space.categorical("optimizer", List.of("sgd", "adam"));
        lr.enableIf(optimizer.eq("sgd"));

        UnresolvedReferenceException e = assertThrows(UnresolvedReferenceException.class,
                () -> space.instantiate(new RecordingBackend()));
        assertEquals("optimizer", e.getLogInfo().get("reference"));
    }

    @Test
    public void unsupportedComparisonFailsCompilation() {
        Space space = new Space();
        ContinuousDimension a = space.uniform("a", 0, 1);
        space.uniform("b", 0, 1).enableIf(a.lt(0.5));

        RecordingBackend backend = new RecordingBackend(EnumSet.of(ComparisonType.EQ), EnumSet.allOf(CombinatorType.class));
        UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class, () -> space.instantiate(backend));
        assertEquals("lt", e.getLogInfo().get("operator"));
        assertEquals("recording", e.getLogInfo().get("backend"));
    }

    @Test
    public void unsupportedCombinatorFailsBeforeItsOperands() {
        Space space = new Space();
        ContinuousDimension a = space.uniform("a", 0, 1);
        space.uniform("b", 0, 1).forbid(Conditions.either(a.eq(0), Conditions.eq("missing", 1)));

        RecordingBackend backend = new RecordingBackend(EnumSet.allOf(ComparisonType.class), EnumSet.of(CombinatorType.AND));
        UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class, () -> space.instantiate(backend));
        assertEquals("or", e.getLogInfo().get("operator"));
        assertEquals("forbid", e.getLogInfo().get("mode"));
    }

    @Test
    public void variablesAreNotCompiled() {
        Space space = new Space();
        space.uniform("a", 0, 1);
        space.variable("epoch");
        RecordingBackend.Handle handle = space.instantiate(new RecordingBackend());
        assertThat(handle.getEvents(), contains("parameter a"));
    }
}
