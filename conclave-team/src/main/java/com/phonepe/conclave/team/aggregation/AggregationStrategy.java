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

package com.phonepe.conclave.team.aggregation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

/**
 * How parallel responses get combined
 */
@Getter
@AllArgsConstructor
public enum AggregationStrategy {
    /**
     * Text of the first surviving response in team order
     */
    FIRST_WINS("first-wins"),
    /**
     * Most common trimmed text. Ties go to the text seen first.
     */
    MAJORITY_VOTE("majority-vote"),
    /**
     * All responses labelled with the agent name, separated by a blank line
     */
    MERGE_ALL("merge-all"),
    /**
     * User supplied {@link ResponseReducer}
     */
    CUSTOM("custom"),
    ;

    @JsonValue
    private final String value;

    @JsonCreator
    public static AggregationStrategy fromValue(String strategy) {
        return Arrays.stream(values())
                .filter(value -> value.value.equalsIgnoreCase(strategy) || value.name().equalsIgnoreCase(strategy))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown aggregation strategy: \"" + strategy + "\""));
    }
}
