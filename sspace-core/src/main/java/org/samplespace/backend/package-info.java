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
 * The contract between a space tree and the sampling engines that compile it.
 *
 * <p>
 * A {@link org.samplespace.backend.SpaceBackend} compiles a tree into an engine specific handle and samples
 * from it deterministically. {@link org.samplespace.backend.SpaceCompiler} implements the tree walk shared by
 * every engine, and {@link org.samplespace.backend.SpaceBackends} finds engines on the class path.
 * </p>
 */
package org.samplespace.backend;
