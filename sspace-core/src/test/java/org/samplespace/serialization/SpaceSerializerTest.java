/*
 * SpaceSerializerTest.java
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

package org.samplespace.serialization;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.conditions.Conditions;
import org.samplespace.expressions.CategoricalDimension;
import org.samplespace.expressions.ContinuousDimension;
import org.samplespace.expressions.Dimension;
import org.samplespace.expressions.OrdinalDimension;
import org.samplespace.expressions.Space;
import org.samplespace.test.Tags;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SpaceSerializer} and {@link SpaceDeserializer}.
 */
public class SpaceSerializerTest {

    private static Space exampleSpace() {
        Space space = new Space();
        CategoricalDimension optimizer = space.categorical("optimizer", ImmutableMap.of("sgd", 1, "adam", 3));
        ContinuousDimension lr = space.loguniform("optimizer.lr", 1e-5, 1e-1);
        lr.enableIf(optimizer.eq("adam"));
        Space model = space.subspace("model");
        CategoricalDimension kind = model.categorical("kind", List.of("mlp", "cnn"));
        OrdinalDimension depth = model.ordinal("encoder.depth", 2, 4, 8);
        depth.enableIf(Conditions.either(kind.eq("cnn"), Conditions.contains("model.kind", List.of("mlp"))));
        ContinuousDimension dropout = model.normal("dropout", 0.3, 0.1, false, false, 0.05);
        dropout.forbidEqual(0.5);
        dropout.forbid(kind.eq("mlp"));
        space.uniform("epochs", 1, 100, true, false, null);
        space.variable("step");
        space.identity("uid", 12);
        return space;
    }

    @Test
    public void canonicalShape() {
        Map<String, Object> serialized = exampleSpace().serialize();
        assertThat(serialized.keySet(), contains("optimizer", "optimizer.lr", "model", "epochs", "step", "uid"));

        Map<String, Object> lr = new LinkedHashMap<>();
        lr.put("lower", 1e-5);
        lr.put("upper", 1e-1);
        lr.put("discrete", false);
        lr.put("log", true);
        lr.put("quantization", null);
        lr.put("conditionals", Map.of("eq", Map.of("name", "optimizer", "value", "adam")));
        assertEquals(Map.of("uniform", lr), serialized.get("optimizer.lr"));
        assertEquals(Map.of("categorical", Map.of("values", List.of("sgd", "adam"), "weights", List.of(1.0, 3.0))),
                serialized.get("optimizer"));
        assertEquals(Map.of("var", Map.of()), serialized.get("step"));
        assertEquals(Map.of("identity", Map.of("size", 12)), serialized.get("uid"));

        @SuppressWarnings("unchecked")
        Map<String, Object> model = (Map<String, Object>) serialized.get("model");
        assertThat(model.keySet(), contains("kind", "encoder", "dropout"));
        assertEquals(Map.of("depth", Map.of("ordinal", Map.of("sequence", List.of(2, 4, 8),
                "conditionals", Map.of("or", List.of(
                        Map.of("eq", Map.of("name", "model.kind", "value", "cnn")),
                        Map.of("in", Map.of("name", "model.kind", "value", List.of("mlp")))))))),
                model.get("encoder"));
    }

    @Test
    public void canonicalFormIsFixedPoint() {
        Space original = exampleSpace();
        Map<String, Object> serialized = original.serialize();
        Space rebuilt = Space.fromMap(serialized);

        assertEquals(serialized, rebuilt.serialize());
        Dimension dropout = ((Space) rebuilt.getChild("model")).getChild("dropout");
        assertNotNull(dropout);
        assertEquals(((Space) original.getChild("model")).getChild("dropout"), dropout);
        assertEquals("both(eq(model.dropout, 0.5), eq(model.kind, mlp))", dropout.getForbidden().toString());
    }

    @Test
    public void subspacesNamedLikeConstructors() {
        Space space = new Space();
        space.uniform("init.normal", 0, 1);
        space.categorical("activation.var", List.of("relu", "tanh"));
        space.ordinal("schedule.uniform", 1, 2, 4);
        space.normal("outer.normal.loc", 0, 1);
        space.subspace("unused.identity");

        Map<String, Object> serialized = space.serialize();
        assertThat(serialized.keySet(), contains("init", "activation", "schedule", "outer"));
        Space rebuilt = Space.fromMap(serialized);
        assertEquals(serialized, rebuilt.serialize());
        assertThat(((Space) rebuilt.getChild("init")).getChild("normal"), instanceOf(ContinuousDimension.class));
        assertThat(((Space) rebuilt.getChild("activation")).getChild("var"), instanceOf(CategoricalDimension.class));
        Space outer = (Space) rebuilt.getChild("outer");
        assertThat(((Space) outer.getChild("normal")).getChild("loc"), instanceOf(ContinuousDimension.class));
        assertTrue(rebuilt.getVariables().isEmpty());
    }

    @Test
    public void rejectedDirectiveLeavesTargetUnchanged() {
        Space target = new Space();
        assertThrows(SpaceCoreArgumentException.class,
                () -> Space.fromMap(Map.of("uid", Map.of("identity", Map.of("size", 4,
                        "conditionals", Map.of("eq", Map.of("name", "a", "value", 1))))), target));
        assertNull(target.getIdentityField());
        assertThrows(SpaceCoreArgumentException.class,
                () -> Space.fromMap(Map.of("step", Map.of("var", Map.of(
                        "forbid", Map.of("eq", Map.of("name", "a", "value", 1))))), target));
        assertTrue(target.getVariables().isEmpty());
    }

    @Test
    public void mixedEncodings() {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("kind", "categorical(values=['mlp', 'cnn'])");
        model.put("depth", Map.of("ordinal", Map.of("sequence", List.of(1, 2, 3))));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("lr", "loguniform(1e-4, 1e-1)");
        data.put("model", model);
        data.put("dropout", Map.of("uniform", Map.of("lower", 0, "upper", 1,
                "conditionals", Map.of("eq", Map.of("name", "model.kind", "value", "mlp")))));

        Space space = Space.fromMap(data);
        assertThat(space.getChildren().keySet(), contains("lr", "model", "dropout"));
        ContinuousDimension lr = (ContinuousDimension) space.getChild("lr");
        assertTrue(lr.isLog());
        assertEquals(1e-4, lr.getLower());
        Space rebuiltModel = (Space) space.getChild("model");
        assertThat(rebuiltModel.getChild("depth"), instanceOf(OrdinalDimension.class));
        assertEquals(Conditions.eq("model.kind", "mlp"), space.getChild("dropout").getCondition());
    }

    @Test
    public void existingSubspaceIsReused() {
        Space target = new Space();
        Space model = target.subspace("model");
        Space.fromMap(Map.of("model", Map.of("depth", "ordinal(1, 2)")), target);
        assertThat(model.getChild("depth"), instanceOf(OrdinalDimension.class));
    }

    @Test
    public void malformedInput() {
        assertThrows(SpaceCoreArgumentException.class, () -> Space.fromMap(Map.of("a", 1)));
        assertThrows(SpaceCoreArgumentException.class,
                () -> Space.fromMap(Map.of("a", Map.of("uniform", Map.of("lower", 0, "upper", 1, "shape", 2)))));
        assertThrows(SpaceCoreArgumentException.class,
                () -> Space.fromMap(Map.of("a", Map.of("uniform", Map.of("lower", 0)))));
        assertThrows(SpaceCoreArgumentException.class,
                () -> Space.fromMap(Map.of("uid", Map.of("identity", Map.of("size", 4,
                        "conditionals", Map.of("eq", Map.of("name", "a", "value", 1)))))));
        assertThrows(SpaceCoreArgumentException.class,
                () -> SpaceDeserializer.deserializeCondition(Map.of("or", List.of(Map.of("eq", Map.of("name", "a"))))));
    }

    @Test
    public void conditionsRoundTrip() {
        Map<String, Object> serialized = SpaceSerializer.serializeCondition(
                Conditions.both(Conditions.ne("a", "x"), Conditions.gt("b", 2)));
        assertEquals(Map.of("and", List.of(
                Map.of("ne", Map.of("name", "a", "value", "x")),
                Map.of("gt", Map.of("name", "b", "value", 2)))), serialized);
        assertEquals(Conditions.both(Conditions.ne("a", "x"), Conditions.gt("b", 2)),
                SpaceDeserializer.deserializeCondition(serialized));
    }

    @Test
    @Tag(Tags.UsesFiles)
    public void jsonFileRoundTrip(@TempDir Path directory) throws IOException {
        Space original = exampleSpace();
        original.categorical("units", List.of(16, 32));
        original.categorical("flags", ImmutableMap.of(true, 1, false, 2));
        Path file = directory.resolve("spaces").resolve("example.json");
        original.toJson(file);

        Space rebuilt = Space.fromJson(file);
        assertEquals(original.serialize(), rebuilt.serialize());
        assertEquals(original.toCompactNotation(), rebuilt.toCompactNotation());
        assertThat(((CategoricalDimension) rebuilt.getChild("units")).getChoices(), contains(16, 32));
        assertThat(((CategoricalDimension) rebuilt.getChild("flags")).getChoices(), contains(true, false));
    }
}
