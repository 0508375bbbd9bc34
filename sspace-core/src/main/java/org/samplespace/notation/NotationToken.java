/*
 * NotationToken.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One token of compact notation text.
 */
@API(API.Status.INTERNAL)
public final class NotationToken {
    /**
     * Kinds of tokens.
     */
    public enum Type {
        OPERATOR,
        SEPARATOR,
        IDENTIFIER,
        NUMBER,
        STRING,
        END
    }

    @Nonnull
    private final Type type;
    @Nonnull
    private final String text;
    @Nullable
    private final Object value;
    private final int position;

    NotationToken(@Nonnull Type type, @Nonnull String text, @Nullable Object value, int position) {
        this.type = type;
        this.text = text;
        this.value = value;
        this.position = position;
    }

    @Nonnull
    public Type getType() {
        return type;
    }

    /**
     * The token as written, quotes and escapes included.
     * @return the source text of the token
     */
    @Nonnull
    public String getText() {
        return text;
    }

    /**
     * The value of a {@link Type#NUMBER} or {@link Type#STRING} token.
     * @return the parsed number or the unescaped string
     */
    @Nullable
    public Object getValue() {
        return value;
    }

    public int getPosition() {
        return position;
    }

    public boolean is(@Nonnull Type expectedType, @Nonnull String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
