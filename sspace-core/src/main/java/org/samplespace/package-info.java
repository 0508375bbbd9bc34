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
 * Declarative, hierarchical parameter spaces.
 *
 * <p>
 * A {@link org.samplespace.expressions.Space} is built from dimensions and nested subspaces, decorated with
 * {@linkplain org.samplespace.conditions.Condition conditions}, and then compiled by a
 * {@link org.samplespace.backend.SpaceBackend} into a handle that produces deterministic samples.
 * The same tree can be persisted in a canonical nested mapping ({@link org.samplespace.serialization})
 * or in the denser compact notation ({@link org.samplespace.notation}).
 * </p>
 */
package org.samplespace;
