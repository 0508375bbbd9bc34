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
 * The space tree and the dimensions it holds.
 *
 * <p>
 * A {@link org.samplespace.expressions.Space} is built through its factory methods, decorated with
 * {@linkplain org.samplespace.conditions conditions}, then either compiled by a
 * {@linkplain org.samplespace.backend backend} and sampled, or persisted through the
 * {@linkplain org.samplespace.serialization canonical form} and the {@linkplain org.samplespace.notation compact
 * notation}. Every consumer walks the tree with a {@link org.samplespace.expressions.DimensionVisitor}.
 * </p>
 */
package org.samplespace.expressions;
