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

import com.phonepe.conclave.core.agent.AgentResponse;
import lombok.NonNull;
import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Pure functions to combine responses from a parallel run
 */
@UtilityClass
public class Aggregation {

    /**
     * Combine responses as per the strategy
     *
     * @param strategy  Strategy to use
     * @param responses Surviving responses in team order
     * @param reducer   Reducer, needed only for {@link AggregationStrategy#CUSTOM}
     * @return Final output. Empty string if there is nothing to aggregate.
     * @throws IllegalArgumentException if a custom strategy is requested without a reducer
     */
    public static String aggregate(@NonNull AggregationStrategy strategy,
                                   List<AgentResponse> responses,
                                   ResponseReducer reducer) {
        if (null == responses || responses.isEmpty()) {
            return "";
        }
        return switch (strategy) {
            case FIRST_WINS -> firstWins(responses);
            case MAJORITY_VOTE -> majorityVote(responses);
            case MERGE_ALL -> mergeAll(responses);
            case CUSTOM -> {
                if (null == reducer) {
                    throw new IllegalArgumentException(
                            "Aggregation strategy \"custom\" requires a customReducer function.");
                }
                yield reducer.reduce(List.copyOf(responses));
            }
        };
    }

    public static String firstWins(List<AgentResponse> responses) {
        return responses.get(0).getText();
    }

    public static String majorityVote(List<AgentResponse> responses) {
        final var counts = new LinkedHashMap<String, Integer>();
        responses.forEach(response -> counts.merge(response.getText().trim(), 1, Integer::sum));
        var best = "";
        var bestCount = 0;
        for (final var entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    public static String mergeAll(List<AgentResponse> responses) {
        return responses.stream()
                .map(Aggregation::labelled)
                .collect(Collectors.joining("\n\n"));
    }

    /**
     * @return The response text prefixed with the name of the agent that produced it
     */
    public static String labelled(AgentResponse response) {
        return "[" + response.getAgentName() + "]: " + response.getText();
    }
}
