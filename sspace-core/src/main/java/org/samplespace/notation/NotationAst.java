/*
 * NotationAst.java
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

import com.google.common.collect.ImmutableList;
import org.samplespace.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Syntax tree of compact notation expressions, as built by {@link NotationParser}.
 */
@API(API.Status.INTERNAL)
public final class NotationAst {

    private NotationAst() {
    }

    /**
     * Visitor over the node kinds.
     * @param <T> the result of visiting one node
     */
    public interface Visitor<T> {
        T visitCall(@Nonnull Call call);

        T visitList(@Nonnull ListExpression list);

        T visitLiteral(@Nonnull Literal literal);

        T visitIdentifier(@Nonnull Identifier identifier);

        T visitBinary(@Nonnull Binary binary);
    }

    /**
     * Base class of the nodes. Every node remembers the offset of its first token.
     */
    public abstract static class Node {
        private final int position;

        Node(int position) {
            this.position = position;
        }

        public int getPosition() {
            return position;
        }

        public abstract <T> T accept(@Nonnull Visitor<T> visitor);
    }

    /**
     * {@code name(argument, keyword=argument, ...)}.
     */
    public static final class Call extends Node {
        @Nonnull
        private final String name;
        @Nonnull
        private final List<Argument> arguments;

        Call(int position, @Nonnull String name, @Nonnull List<Argument> arguments) {
            super(position);
            this.name = name;
            this.arguments = ImmutableList.copyOf(arguments);
        }

        @Nonnull
        public String getName() {
            return name;
        }

        @Nonnull
        public List<Argument> getArguments() {
            return arguments;
        }

        @Override
        public <T> T accept(@Nonnull Visitor<T> visitor) {
            return visitor.visitCall(this);
        }
    }

    /**
     * One argument of a {@link Call}, positional when it has no keyword.
     */
    public static final class Argument {
        @Nullable
        private final String keyword;
        @Nonnull
        private final Node value;

        Argument(@Nullable String keyword, @Nonnull Node value) {
            this.keyword = keyword;
            this.value = value;
        }

        @Nullable
        public String getKeyword() {
            return keyword;
        }

        @Nonnull
        public Node getValue() {
            return value;
        }
    }

    /**
     * {@code [element, ...]}.
     */
    public static final class ListExpression extends Node {
        @Nonnull
        private final List<Node> elements;

        ListExpression(int position, @Nonnull List<Node> elements) {
            super(position);
            this.elements = ImmutableList.copyOf(elements);
        }

        @Nonnull
        public List<Node> getElements() {
            return elements;
        }

        @Override
        public <T> T accept(@Nonnull Visitor<T> visitor) {
            return visitor.visitList(this);
        }
    }

    /**
     * A number, a string, {@code true}, {@code false} or {@code none}.
     */
    public static final class Literal extends Node {
        @Nullable
        private final Object value;

        Literal(int position, @Nullable Object value) {
            super(position);
            this.value = value;
        }

        @Nullable
        public Object getValue() {
            return value;
        }

        @Override
        public <T> T accept(@Nonnull Visitor<T> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    /**
     * A bare name, possibly dotted. Only valid where a dimension is referenced.
     */
    public static final class Identifier extends Node {
        @Nonnull
        private final String name;

        Identifier(int position, @Nonnull String name) {
            super(position);
            this.name = name;
        }

        @Nonnull
        public String getName() {
            return name;
        }

        @Override
        public <T> T accept(@Nonnull Visitor<T> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    /**
     * An infix operation: a comparison or a combination of conditions.
     */
    public static final class Binary extends Node {
        @Nonnull
        private final String operator;
        @Nonnull
        private final Node left;
        @Nonnull
        private final Node right;

        Binary(int position, @Nonnull String operator, @Nonnull Node left, @Nonnull Node right) {
            super(position);
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Nonnull
        public String getOperator() {
            return operator;
        }

        @Nonnull
        public Node getLeft() {
            return left;
        }

        @Nonnull
        public Node getRight() {
            return right;
        }

        @Override
        public <T> T accept(@Nonnull Visitor<T> visitor) {
            return visitor.visitBinary(this);
        }
    }
}
