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

package com.phonepe.conclave.team;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

/**
 * Policy governing how the agents of a team are invoked and their outputs combined
 */
@Getter
@AllArgsConstructor
public enum CoordinationMode {
    SEQUENTIAL("sequential"),
    PARALLEL("parallel"),
    DEBATE("debate"),
    SUPERVISOR("supervisor"),
    CUSTOM("custom"),
    ;

    @JsonValue
    private final String value;

    /**
     * Resolve a mode from its wire value or enum name, ignoring case
     *
     * @throws IllegalArgumentException for unknown modes
     */
    @JsonCreator
    public static CoordinationMode fromValue(String mode) {
        return Arrays.stream(values())
                .filter(value -> value.value.equalsIgnoreCase(mode) || value.name().equalsIgnoreCase(mode))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown coordination mode: \"" + mode + "\""));
    }
}
