/*
 * UnresolvedReferenceException.java
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

package org.samplespace.backend;

import org.samplespace.SpaceCoreException;
import org.samplespace.annotation.API;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Thrown at compile time when a condition refers to a dimension that is not in the scope being compiled.
 */
@API(API.Status.STABLE)
public class UnresolvedReferenceException extends SpaceCoreException {
    private static final long serialVersionUID = 1;

    public UnresolvedReferenceException(@Nonnull String reference, @Nonnull String scope) {
        super("condition refers to an unknown dimension",
                LogMessageKeys.REFERENCE, reference,
                LogMessageKeys.SCOPE, scope.isEmpty() ? "<root>" : scope);
    }
}
