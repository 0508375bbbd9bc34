/*
 * ConditionsTest.java
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

package org.samplespace.conditions;

import org.junit.jupiter.api.Test;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.expressions.CategoricalDimension;
import org.samplespace.expressions.Space;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link Conditions} and the condition types.
 */
public class ConditionsTest {

    @Test
    public void dimensionConditionsReferToPath() {
        Space space = new Space();
        CategoricalDimension kind = space.categorical("model.kind", List.of("mlp", "cnn"));
        LeafCondition condition = kind.eq("mlp");
        assertEquals(ComparisonType.EQ, condition.getType());
        assertEquals("model.kind", condition.getReference());
        assertEquals(Conditions.eq("model.kind", "mlp"), condition);
    }

    @Test
    public void inValuesAreCopiedAndNormalized() {
        List<Object> values = new ArrayList<>(List.of(1L, 2.5f));
        LeafCondition condition = Conditions.contains("a", values);
        values.add(3);
        assertThat(condition.getValues(), contains(1, 2.5));
        assertThrows(UnsupportedOperationException.class, () -> condition.getValues().add(4));
        assertThrows(IllegalStateException.class, () -> Conditions.eq("a", 1).getValues());
    }

    @Test
    public void invalidComparisons() {
        assertThrows(SpaceCoreArgumentException.class, () -> Conditions.leaf("in", "a", 1));
        assertThrows(SpaceCoreArgumentException.class, () -> Conditions.contains("a", java.util.Arrays.asList(1, null)));
        assertThrows(SpaceCoreArgumentException.class, () -> Conditions.leaf("lt", "a", null));
        assertThrows(SpaceCoreArgumentException.class, () -> Conditions.leaf("like", "a", 1));
        assertThrows(SpaceCoreArgumentException.class, () -> Conditions.combine("xor", Conditions.eq("a", 1), Conditions.eq("b", 2)));
    }

    @Test
    public void operatorNames() {
        assertSame(ComparisonType.IN, ComparisonType.fromOperatorName("contains"));
        assertSame(ComparisonType.IN, ComparisonType.fromOperatorName("in"));
        assertSame(CombinatorType.AND, CombinatorType.fromOperatorName("both"));
        assertSame(CombinatorType.OR, CombinatorType.fromOperatorName("or"));
        assertEquals(Conditions.either(Conditions.eq("a", 1), Conditions.ne("b", "x")),
                Conditions.combine("or", Conditions.leaf("eq", "a", 1L), Conditions.leaf("ne", "b", "x")));
    }

    @Test
    public void renderedForm() {
        Condition condition = Conditions.both(Conditions.gt("a", 1), Conditions.either(Conditions.lt("b", 2.5), Conditions.eq("c", null)));
        assertEquals("both(gt(a, 1), either(lt(b, 2.5), eq(c, null)))", condition.toString());
    }
}
