/*
 * CompactNotationException.java
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

import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Thrown when compact notation text cannot be read. The offending token and its offset in the text are part
 * of the message and of the log info.
 */
@API(API.Status.STABLE)
public class CompactNotationException extends SpaceCoreArgumentException {
    private static final long serialVersionUID = 1;

    private final int position;
    @Nonnull
    private final String token;

    public CompactNotationException(@Nonnull String msg, @Nonnull String text, int position, @Nonnull String token) {
        super(msg + " '" + token + "' at position " + position,
                LogMessageKeys.TEXT, text,
                LogMessageKeys.POSITION, position,
                LogMessageKeys.TOKEN, token);
        this.position = position;
        this.token = token;
    }

    /**
     * Offset of the offending token in the text.
     * @return the offset
     */
    public int getPosition() {
        return position;
    }

    @Nonnull
    public String getToken() {
        return token;
    }
}
