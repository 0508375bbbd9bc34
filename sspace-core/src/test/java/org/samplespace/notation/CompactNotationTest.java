/*
 * CompactNotationTest.java
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

package org.samplespace.notation;

import org.junit.jupiter.api.Test;
import org.samplespace.conditions.Condition;
import org.samplespace.conditions.Conditions;
import org.samplespace.expressions.CategoricalDimension;
import org.samplespace.expressions.ContinuousDimension;
import org.samplespace.expressions.Dimension;
import org.samplespace.expressions.OrdinalDimension;
import org.samplespace.expressions.Space;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CompactNotation}.
 */
public class CompactNotationTest {

    @Test
    public void continuousConstructors() {
        Space space = new Space();
        ContinuousDimension lr = (ContinuousDimension) CompactNotation.parseInto(space, "lr", "loguniform(lower=1, upper=2)");
        assertTrue(lr.isLog());
        assertEquals(1, lr.getLower());

        ContinuousDimension epochs = (ContinuousDimension) CompactNotation.parseInto(space, "epochs", "uniform(0, 10, true)");
        assertTrue(epochs.isDiscrete());
        assertFalse(epochs.isLog());

        ContinuousDimension noise = (ContinuousDimension) CompactNotation.parseInto(space, "noise",
                "normal(loc=-1.5, scale=0.5, quantization=0.1)");
        assertEquals(-1.5, noise.getLoc());
        assertEquals(0.1, noise.getQuantization());
    }

    @Test
    public void discreteValueConstructors() {
        Space space = new Space();
        CategoricalDimension optimizer = (CategoricalDimension) CompactNotation.parseInto(space, "optimizer",
                "categorical(values=['sgd', 'adam'], weights=[1, 3])");
        assertEquals(List.of(1.0, 3.0), optimizer.getWeights());
        CategoricalDimension activation = (CategoricalDimension) CompactNotation.parseInto(space, "activation",
                "choices(['relu', 'tanh'])");
        assertTrue(activation.hasEqualWeights());

        OrdinalDimension a = (OrdinalDimension) CompactNotation.parseInto(space, "a", "ordinal(1, 2, 3)");
        OrdinalDimension b = (OrdinalDimension) CompactNotation.parseInto(space, "b", "ordinal([1, 2, 3])");
        OrdinalDimension c = (OrdinalDimension) CompactNotation.parseInto(space, "c", "ordinal(sequence=['x', 'y'])");
        assertEquals(List.of(1, 2, 3), a.getSequence());
        assertEquals(a.getSequence(), b.getSequence());
        assertEquals(List.of("x", "y"), c.getSequence());
    }

    @Test
    public void directives() {
        Space space = new Space();
        assertThat(CompactNotation.parseInto(space, "step", "var()"), instanceOf(Dimension.class));
        assertNull(CompactNotation.parseInto(space, "uid", "identity(size=8)"));
        assertEquals("uid", space.getIdentityField());
        assertEquals(8, space.getIdentitySize());
        assertThat(space.getVariables().keySet(), contains("step"));
    }

    @Test
    public void directivesWithConditionsAreRejectedBeforeApplying() {
        Space space = new Space();
        assertThrows(CompactNotationException.class,
                () -> CompactNotation.parseInto(space, "uid", "identity(size=8, condition=eq(a, 1))"));
        assertNull(space.getIdentityField());
        assertThrows(CompactNotationException.class,
                () -> CompactNotation.parseInto(space, "step", "var(forbid=a == 1)"));
        assertTrue(space.getVariables().isEmpty());
        assertNull(space.getChild("step"));
    }

    @Test
    public void conditionsAndForbiddenClauses() {
        Space space = new Space();
        CompactNotation.parseInto(space, "optimizer", "categorical(values=['sgd', 'adam', 'rmsprop'])");
        Dimension momentum = CompactNotation.parseInto(space, "momentum",
                "uniform(0, 1, condition=optimizer == 'sgd' | optimizer == 'rmsprop', forbid=eq(optimizer, 'adam'))");
        assertEquals(Conditions.either(Conditions.eq("optimizer", "sgd"), Conditions.eq("optimizer", "rmsprop")),
                momentum.getCondition());
        assertEquals(Conditions.eq("optimizer", "adam"), momentum.getForbidden());
    }

    @Test
    public void definitions() {
        Space space = new Space();
        CompactNotation.parseDefinition(space, "model.momentum ~ uniform(0, 1)");
        Space model = (Space) space.getChild("model");
        assertThat(model.getChild("momentum"), instanceOf(ContinuousDimension.class));
    }

    @Test
    public void infixAndCallConditionsAgree() {
        Condition infix = CompactNotation.parseCondition("a == 1 | b > 2 & c != 'x'");
        Condition calls = CompactNotation.parseCondition("either(eq(a, 1), both(gt(b, 2), ne(c, 'x')))");
        assertEquals(calls, infix);
        assertEquals(Conditions.contains("weird name", List.of(1, 2)), CompactNotation.parseCondition("contains('weird name', [1, 2])"));
        assertEquals(Conditions.leaf("lt", "a", -3), CompactNotation.parseCondition("a < -3"));
    }

    @Test
    public void interpretationErrors() {
        Space space = new Space();
        CompactNotationException e = assertThrows(CompactNotationException.class,
                () -> CompactNotation.parseInto(space, "a", "uniformm(0, 1)"));
        assertEquals("unknown constructor 'uniformm' at position 0", e.getMessage());

        e = assertThrows(CompactNotationException.class,
                () -> CompactNotation.parseInto(space, "a", "uniform(0, 1, condition=like(b, 1))"));
        assertEquals("unknown constructor 'like' at position 24", e.getMessage());

        e = assertThrows(CompactNotationException.class,
                () -> CompactNotation.parseInto(space, "a", "uniform(lower=0, lower=1, upper=2)"));
        assertEquals("duplicate argument 'lower' at position 23", e.getMessage());

        e = assertThrows(CompactNotationException.class, () -> CompactNotation.parseInto(space, "a", "1"));
        assertEquals("expected a constructor call '1' at position 0", e.getMessage());

        e = assertThrows(CompactNotationException.class,
                () -> CompactNotation.parseInto(space, "a", "categorical(values=[sgd])"));
        assertEquals("unexpected identifier 'sgd' at position 20", e.getMessage());

        e = assertThrows(CompactNotationException.class, () -> CompactNotation.parseCondition("eq(a, 1, 2)"));
        assertEquals(0, e.getPosition());

        assertTrue(space.getChildren().isEmpty());
    }

    @Test
    public void renderLeaves() {
        Space space = new Space();
        assertEquals("loguniform(lower=1.0E-4, upper=0.1)", CompactNotation.render(space.loguniform("lr", 1e-4, 0.1)));
        assertEquals("uniform(lower=1, upper=100, discrete=true, quantization=5)",
                CompactNotation.render(space.uniform("epochs", 1, 100, true, false, 5)));
        assertEquals("categorical(values=['a', 'b'])", CompactNotation.render(space.categorical("c", List.of("a", "b"))));
        Map<String, Integer> weighted = new LinkedHashMap<>();
        weighted.put("x", 1);
        weighted.put("y", 3);
        assertEquals("categorical(values=['x', 'y'], weights=[1.0, 3.0])", CompactNotation.render(space.categorical("w", weighted)));
        assertEquals("ordinal(sequence=[1, 'two', 3.5])", CompactNotation.render(space.ordinal("o", 1, "two", 3.5)));
    }

    @Test
    public void renderConditions() {
        assertEquals("either(eq('weird name', true), contains(model.kind, ['mlp']))", CompactNotation.render(
                Conditions.either(Conditions.eq("weird name", true), Conditions.contains("model.kind", List.of("mlp")))));
        assertEquals("ne('true', 'it\\'s')", CompactNotation.render(Conditions.ne("true", "it's")));
    }

    @Test
    public void subspacesNamedLikeConstructorsReadBack() {
        Space space = new Space();
        space.uniform("init.normal.loc", 0, 1);
        space.categorical("outer.uniform", List.of(1, 2));

        Map<String, Object> rendered = space.toCompactNotation();
        assertEquals(Map.of("init", Map.of("normal", Map.of("loc", "uniform(lower=0, upper=1)")),
                "outer", Map.of("uniform", "categorical(values=[1, 2])")), rendered);
        Space rebuilt = Space.fromMap(rendered);
        assertEquals(rendered, rebuilt.toCompactNotation());
        assertEquals(space.serialize(), rebuilt.serialize());
    }

    @Test
    public void renderedSpaceReadsBack() {
        Space space = new Space();
        CategoricalDimension optimizer = space.categorical("optimizer", List.of("sgd", "adam"));
        space.loguniform("optimizer.lr", 1e-5, 1e-1).enableIf(optimizer.eq("adam"));
        Space model = space.subspace("model");
        CategoricalDimension kind = model.categorical("kind", List.of("mlp", "cnn"));
        model.ordinal("encoder.depth", 2, 4, 8).enableIf(Conditions.either(kind.eq("cnn"), kind.in(List.of("mlp"))));
        ContinuousDimension dropout = model.lognormal("dropout", -2, 0.5);
        dropout.forbidEqual(0.5);
        dropout.forbid(kind.eq("mlp"));
        space.variable("step");
        space.identity("uid", 12);

        Map<String, Object> rendered = space.toCompactNotation();
        assertEquals("loguniform(lower=1.0E-5, upper=0.1, condition=eq(optimizer, 'adam'))", rendered.get("optimizer.lr"));
        assertEquals(Map.of("kind", "categorical(values=['mlp', 'cnn'])",
                "encoder", Map.of("depth", "ordinal(sequence=[2, 4, 8], "
                        + "condition=either(eq(model.kind, 'cnn'), contains(model.kind, ['mlp'])))"),
                "dropout", "lognormal(loc=-2, scale=0.5, forbid=both(eq(model.dropout, 0.5), eq(model.kind, 'mlp')))"),
                rendered.get("model"));

        Space rebuilt = Space.fromMap(rendered);
        assertEquals(space.serialize(), rebuilt.serialize());
        assertEquals(rendered, rebuilt.toCompactNotation());
    }
}
