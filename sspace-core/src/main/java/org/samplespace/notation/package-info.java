/*
 * package-info.java
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

/**
 * Compact notation: every dimension written as a single call such as {@code uniform(lower=0, upper=1)}.
 *
 * <p>
 * Text is read in three passes: {@link org.samplespace.notation.NotationLexer} produces tokens,
 * {@link org.samplespace.notation.NotationParser} builds a {@link org.samplespace.notation.NotationAst} by
 * recursive descent, and {@link org.samplespace.notation.NotationInterpreter} evaluates it against a fixed table
 * of constructors. {@link org.samplespace.notation.NotationRenderer} writes the text back.
 * </p>
 */
package org.samplespace.notation;
