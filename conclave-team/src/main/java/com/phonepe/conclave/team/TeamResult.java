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

import com.phonepe.conclave.core.agent.AgentResponse;
import com.phonepe.conclave.core.model.Usage;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Synthesized outcome of a team run
 */
@Value
@Builder
public class TeamResult {
    @NonNull
    String finalOutput;

    /**
     * Responses that were actually used, in invocation order. Failed calls never show up here.
     */
    @Singular
    List<AgentResponse> agentResults;

    int rounds;

    @NonNull
    @Builder.Default
    Usage totalUsage = Usage.empty();

    /**
     * Build a result whose usage is the sum of the usage of the given responses
     */
    public static TeamResult of(String finalOutput, List<AgentResponse> agentResults, int rounds) {
        return TeamResult.builder()
                .finalOutput(finalOutput)
                .agentResults(agentResults)
                .rounds(rounds)
                .totalUsage(Usage.sum(agentResults))
                .build();
    }
}
