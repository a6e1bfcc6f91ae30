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

import com.phonepe.conclave.team.aggregation.AggregationStrategy;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Serializable description of a team. Agents are referred to by name and resolved using
 * {@link TeamDefinitionResolver}.
 */
@Value
@Builder
@Jacksonized
public class TeamDefinition {
    @NonNull
    String name;

    /**
     * One of sequential, parallel, debate, supervisor or custom
     */
    @NonNull
    String coordinationMode;

    Integer maxRounds;

    @Singular
    List<MemberDefinition> members;

    /**
     * Parallel teams only
     */
    AggregationStrategy aggregationStrategy;

    /**
     * Parallel teams only
     */
    Long agentTimeoutMs;

    /**
     * Debate teams only
     */
    Integer rounds;

    /**
     * Name of the judge agent for debate teams
     */
    String judge;

    /**
     * Name of the coordinator agent for supervisor teams
     */
    String supervisor;
}
