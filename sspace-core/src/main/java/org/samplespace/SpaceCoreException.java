/*
 * SpaceCoreException.java
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

package org.samplespace;

import org.samplespace.annotation.API;
import org.samplespace.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Root of the exceptions raised while building, compiling, persisting or sampling a space.
 */
@API(API.Status.STABLE)
public class SpaceCoreException extends LoggableException {
    private static final long serialVersionUID = 1;

    public SpaceCoreException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public SpaceCoreException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }
}
