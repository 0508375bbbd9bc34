/*
 * NotationInterpreter.java
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

import org.samplespace.annotation.API;
import org.samplespace.conditions.CombinatorType;
import org.samplespace.conditions.ComparisonType;
import org.samplespace.conditions.Condition;
import org.samplespace.conditions.ConditionMode;
import org.samplespace.conditions.Conditions;
import org.samplespace.expressions.Dimension;
import org.samplespace.expressions.Space;
import org.samplespace.serialization.ConstructorArguments;
import org.samplespace.serialization.DimensionConstructors;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates compact notation syntax trees against a fixed table of dimension constructors.
 *
 * <p>
 * A dimension definition is a call to one of the constructors, for instance
 * {@code loguniform(lower=1, upper=2, condition=eq(optimizer, 'adam'))}. Its arguments are plain values
 * (numbers, strings, booleans, {@code none} and lists of those), except {@code condition} and {@code forbid},
 * which are condition expressions. Conditions are either calls to {@code eq, ne, lt, gt, in, contains, either,
 * both, and, or} or the infix forms {@code == != < > & |}. A bare identifier is only valid as the dimension
 * referenced by a comparison.
 * </p>
 *
 * <p>
 * Nothing in the text is executed: every call is looked up in the constructor table and anything else fails
 * with a {@link CompactNotationException}.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class NotationInterpreter {
    /**
     * Keyword of the enablement condition of a dimension.
     */
    public static final String CONDITION = "condition";

    @Nonnull
    private final DimensionConstructors constructors;

    public NotationInterpreter(@Nonnull DimensionConstructors constructors) {
        this.constructors = constructors;
    }

    /**
     * Add the dimension defined by a syntax tree to a space.
     * @param target the space receiving the dimension
     * @param name the name of the dimension
     * @param text the source text, for error messages
     * @param definition the parsed definition
     * @return the new dimension, or {@code null} for a directive such as {@code identity}
     */
    @Nullable
    public Dimension interpretDimension(@Nonnull Space target, @Nonnull String name, @Nonnull String text,
                                        @Nonnull NotationAst.Node definition) {
        if (!(definition instanceof NotationAst.Call)) {
            throw new CompactNotationException("expected a constructor call", text, definition.getPosition(),
                    describe(definition));
        }
        final NotationAst.Call call = (NotationAst.Call) definition;
        if (!constructors.contains(call.getName())) {
            throw new CompactNotationException("unknown constructor", text, call.getPosition(), call.getName());
        }
        final ValueEvaluator values = new ValueEvaluator(text);
        final ConditionEvaluator conditions = new ConditionEvaluator(text, values);
        final List<Object> positional = new ArrayList<>();
        final Map<String, Object> keywords = new LinkedHashMap<>();
        Condition condition = null;
        Condition forbidden = null;
        for (NotationAst.Argument argument : call.getArguments()) {
            final String keyword = argument.getKeyword();
            if (keyword == null) {
                positional.add(argument.getValue().accept(values));
            } else if (CONDITION.equals(keyword) || ConditionMode.CONDITIONALS.getKey().equals(keyword)) {
                if (condition != null) {
                    throw duplicate(text, argument);
                }
                condition = argument.getValue().accept(conditions);
            } else if (ConditionMode.FORBID.getKey().equals(keyword)) {
                if (forbidden != null) {
                    throw duplicate(text, argument);
                }
                forbidden = argument.getValue().accept(conditions);
            } else {
                if (keywords.containsKey(keyword)) {
                    throw duplicate(text, argument);
                }
                keywords.put(keyword, argument.getValue().accept(values));
            }
        }
        if ((condition != null || forbidden != null) && !constructors.acceptsConditions(call.getName())) {
            throw new CompactNotationException("directive cannot carry conditions", text, call.getPosition(),
                    call.getName());
        }
        final Dimension dimension = constructors.construct(call.getName(), target, name,
                new ConstructorArguments(call.getName(), positional, keywords));
        if (dimension == null) {
            return null;
        }
        if (condition != null) {
            dimension.enableIf(condition);
        }
        if (forbidden != null) {
            dimension.forbid(forbidden);
        }
        return dimension;
    }

    /**
     * Evaluate a syntax tree as a condition.
     * @param text the source text, for error messages
     * @param expression the parsed expression
     * @return the condition
     */
    @Nonnull
    public Condition interpretCondition(@Nonnull String text, @Nonnull NotationAst.Node expression) {
        return expression.accept(new ConditionEvaluator(text, new ValueEvaluator(text)));
    }

    @Nonnull
    private static CompactNotationException duplicate(@Nonnull String text, @Nonnull NotationAst.Argument argument) {
        return new CompactNotationException("duplicate argument", text, argument.getValue().getPosition(),
                String.valueOf(argument.getKeyword()));
    }

    @Nonnull
    private static String describe(@Nonnull NotationAst.Node node) {
        if (node instanceof NotationAst.Call) {
            return ((NotationAst.Call) node).getName();
        } else if (node instanceof NotationAst.Identifier) {
            return ((NotationAst.Identifier) node).getName();
        } else if (node instanceof NotationAst.Binary) {
            return ((NotationAst.Binary) node).getOperator();
        } else if (node instanceof NotationAst.Literal) {
            return String.valueOf(((NotationAst.Literal) node).getValue());
        }
        return "[";
    }

    private static class ValueEvaluator implements NotationAst.Visitor<Object> {
        @Nonnull
        private final String text;

        ValueEvaluator(@Nonnull String text) {
            this.text = text;
        }

        @Override
        public Object visitCall(@Nonnull NotationAst.Call call) {
            throw new CompactNotationException("unexpected call", text, call.getPosition(), call.getName());
        }

        @Override
        public Object visitList(@Nonnull NotationAst.ListExpression list) {
            final List<Object> values = new ArrayList<>(list.getElements().size());
            for (NotationAst.Node element : list.getElements()) {
                values.add(element.accept(this));
            }
            return values;
        }

        @Override
        public Object visitLiteral(@Nonnull NotationAst.Literal literal) {
            return literal.getValue();
        }

        @Override
        public Object visitIdentifier(@Nonnull NotationAst.Identifier identifier) {
            throw new CompactNotationException("unexpected identifier", text, identifier.getPosition(),
                    identifier.getName());
        }

        @Override
        public Object visitBinary(@Nonnull NotationAst.Binary binary) {
            throw new CompactNotationException("unexpected operator", text, binary.getPosition(), binary.getOperator());
        }
    }

    private class ConditionEvaluator implements NotationAst.Visitor<Condition> {
        @Nonnull
        private final String text;
        @Nonnull
        private final ValueEvaluator values;

        ConditionEvaluator(@Nonnull String text, @Nonnull ValueEvaluator values) {
            this.text = text;
            this.values = values;
        }

        @Override
        public Condition visitCall(@Nonnull NotationAst.Call call) {
            final String name = call.getName();
            final boolean comparison = ComparisonType.isOperatorName(name);
            if (!comparison && !CombinatorType.isOperatorName(name)) {
                throw new CompactNotationException(constructors.contains(name) ? "expected a condition" : "unknown constructor",
                        text, call.getPosition(), name);
            }
            final List<NotationAst.Argument> arguments = call.getArguments();
            if (arguments.size() != 2) {
                throw new CompactNotationException("condition takes two arguments", text, call.getPosition(), name);
            }
            final NotationAst.Node left = arguments.get(0).getValue();
            final NotationAst.Node right = arguments.get(1).getValue();
            if (comparison) {
                return Conditions.leaf(name, reference(left), right.accept(values));
            }
            return Conditions.combine(name, left.accept(this), right.accept(this));
        }

        @Override
        public Condition visitBinary(@Nonnull NotationAst.Binary binary) {
            switch (binary.getOperator()) {
                case "|":
                    return Conditions.either(binary.getLeft().accept(this), binary.getRight().accept(this));
                case "&":
                    return Conditions.both(binary.getLeft().accept(this), binary.getRight().accept(this));
                case "==":
                    return Conditions.eq(reference(binary.getLeft()), binary.getRight().accept(values));
                case "!=":
                    return Conditions.ne(reference(binary.getLeft()), binary.getRight().accept(values));
                case "<":
                    return Conditions.leaf(ComparisonType.LT.getOperatorName(), reference(binary.getLeft()),
                            binary.getRight().accept(values));
                case ">":
                    return Conditions.leaf(ComparisonType.GT.getOperatorName(), reference(binary.getLeft()),
                            binary.getRight().accept(values));
                default:
                    throw new CompactNotationException("unexpected operator", text, binary.getPosition(),
                            binary.getOperator());
            }
        }

        @Override
        public Condition visitList(@Nonnull NotationAst.ListExpression list) {
            throw new CompactNotationException("expected a condition", text, list.getPosition(), "[");
        }

        @Override
        public Condition visitLiteral(@Nonnull NotationAst.Literal literal) {
            throw new CompactNotationException("expected a condition", text, literal.getPosition(),
                    String.valueOf(literal.getValue()));
        }

        @Override
        public Condition visitIdentifier(@Nonnull NotationAst.Identifier identifier) {
            throw new CompactNotationException("expected a condition", text, identifier.getPosition(),
                    identifier.getName());
        }

        @Nonnull
        private String reference(@Nonnull NotationAst.Node node) {
            if (node instanceof NotationAst.Identifier) {
                return ((NotationAst.Identifier) node).getName();
            }
            if (node instanceof NotationAst.Literal && ((NotationAst.Literal) node).getValue() instanceof String) {
                return (String) ((NotationAst.Literal) node).getValue();
            }
            throw new CompactNotationException("expected a dimension reference", text, node.getPosition(), describe(node));
        }
    }
}
