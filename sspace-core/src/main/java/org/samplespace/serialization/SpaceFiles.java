/*
 * SpaceFiles.java
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

package org.samplespace.serialization;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.samplespace.annotation.API;
import org.samplespace.logging.KeyValueLogMessage;
import org.samplespace.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes serialized spaces as JSON files. Key order is preserved in both directions.
 */
@API(API.Status.INTERNAL)
public final class SpaceFiles {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpaceFiles.class);
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<LinkedHashMap<String, Object>> MAPPING = new TypeReference<LinkedHashMap<String, Object>>() {
    };

    private SpaceFiles() {
    }

    /**
     * Read a serialized space.
     * @param file path of the JSON file
     * @return the nested mapping held by the file
     * @throws IOException if the file cannot be read or is not a JSON object
     */
    @Nonnull
    public static Map<String, Object> read(@Nonnull Path file) throws IOException {
        final Map<String, Object> data = JSON.readValue(file.toFile(), MAPPING);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("read space",
                    LogMessageKeys.FILE_NAME, file,
                    LogMessageKeys.DIMENSION_COUNT, data.size()));
        }
        return data;
    }

    /**
     * Write a serialized space, replacing the file if it exists.
     * @param file path of the JSON file
     * @param data the nested mapping
     * @throws IOException if writing fails
     */
    public static void write(@Nonnull Path file, @Nonnull Map<String, Object> data) throws IOException {
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JSON.writeValue(file.toFile(), data);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("wrote space",
                    LogMessageKeys.FILE_NAME, file,
                    LogMessageKeys.DIMENSION_COUNT, data.size()));
        }
    }
}
