/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.conclave.team.definition;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.conclave.core.utils.JsonUtils;
import lombok.NonNull;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Reads {@link TeamDefinition}s from JSON
 */
public class TeamDefinitionReader {
    private final ObjectMapper mapper;

    public TeamDefinitionReader() {
        this(JsonUtils.createMapper());
    }

    public TeamDefinitionReader(@NonNull ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public TeamDefinition read(@NonNull String json) throws IOException {
        return mapper.readValue(json, TeamDefinition.class);
    }

    public TeamDefinition read(@NonNull InputStream stream) throws IOException {
        return mapper.readValue(stream, TeamDefinition.class);
    }

    /**
     * Read a definition from the classpath
     *
     * @param resource Resource path, relative to the classpath root
     * @throws FileNotFoundException if there is no such resource
     */
    public TeamDefinition readResource(@NonNull String resource) throws IOException {
        final var loader = Objects.requireNonNullElse(Thread.currentThread().getContextClassLoader(),
                                                      TeamDefinitionReader.class.getClassLoader());
        try (final var stream = loader.getResourceAsStream(resource)) {
            if (null == stream) {
                throw new FileNotFoundException("Team definition resource not found: " + resource);
            }
            return read(stream);
        }
    }
}
