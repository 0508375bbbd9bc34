/*
 * KeyValueLogMessage.java
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

package org.samplespace.logging;

import org.samplespace.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A formatter for log messages.
 *
 * A {@code KeyValueLogMessage} has a static message followed by key-value pairs in {@code key="value"} form,
 * sorted by key.
 */
@API(API.Status.UNSTABLE)
public class KeyValueLogMessage {
    @Nonnull
    private final String staticMessage;
    @Nonnull
    private final Map<String, String> keyValueMap;

    private KeyValueLogMessage(@Nonnull final String staticMessage, @Nonnull Map<String, String> keyValueMap) {
        this.staticMessage = staticMessage;
        this.keyValueMap = keyValueMap;
    }

    @Nonnull
    public static String of(@Nonnull final String staticMessage, @Nullable final Object... keysAndValues) {
        return build(staticMessage, keysAndValues).toString();
    }

    @Nonnull
    public static KeyValueLogMessage build(@Nonnull final String staticMessage, @Nullable final Object... keysAndValues) {
        Map<String, String> keyValueMap = new TreeMap<>();
        if (keysAndValues != null) {
            if (keysAndValues.length % 2 == 1) {
                throw new IllegalArgumentException("keys and values don't match");
            }
            for (int i = 0; i < keysAndValues.length; i += 2) {
                addKeyValueImpl(keyValueMap, keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return new KeyValueLogMessage(staticMessage, keyValueMap);
    }

    private static void addKeyValueImpl(@Nonnull Map<String, String> keyValueMap, @Nullable final Object key, @Nullable Object value) {
        if (key == null) {
            throw new IllegalArgumentException("null key passed to KeyValueLogMessage");
        }
        keyValueMap.put(sanitizeKey(key.toString()), sanitizeValue(Optional.ofNullable(value).orElse("null").toString()));
    }

    @Nonnull
    public KeyValueLogMessage addKeyAndValue(@Nonnull final Object key, @Nullable final Object value) {
        addKeyValueImpl(keyValueMap, key, value);
        return this;
    }

    @Nonnull
    public KeyValueLogMessage addKeysAndValues(@Nonnull final Map<?, ?> map) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            addKeyValueImpl(keyValueMap, entry.getKey(), entry.getValue());
        }
        return this;
    }

    @Nonnull
    private static String sanitizeValue(@Nonnull final String value) {
        return value.replace("\"", "'");
    }

    @Nonnull
    private static String sanitizeKey(@Nonnull final String key) {
        return key.replace("=", "");
    }

    @Nonnull
    public String getStaticMessage() {
        return staticMessage;
    }

    @Nonnull
    public Map<String, String> getKeyValueMap() {
        return Collections.unmodifiableMap(keyValueMap);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(staticMessage.length() + keyValueMap.size() * 30);
        sb.append(staticMessage);
        for (Map.Entry<String, String> entry : keyValueMap.entrySet()) {
            sb.append(' ')
                    .append(entry.getKey())
                    .append("=\"")
                    .append(entry.getValue())
                    .append('"');
        }
        return sb.toString();
    }
}
