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

package com.phonepe.conclave.core.model;

import com.phonepe.conclave.core.agent.AgentResponse;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Token usage reported by an agent run. Immutable; combine instances using {@link #plus(Usage)}.
 */
@Value
@Builder
@Jacksonized
public class Usage {
    private static final Usage EMPTY = new Usage(0, 0, 0);

    int promptTokens;
    int completionTokens;
    int totalTokens;

    public static Usage empty() {
        return EMPTY;
    }

    public static Usage of(int promptTokens, int completionTokens) {
        return new Usage(promptTokens, completionTokens, promptTokens + completionTokens);
    }

    /**
     * Adds the other usage to this one. A null usage is treated as zero.
     *
     * @param other Usage to add
     * @return A new usage object with the sums
     */
    public Usage plus(final Usage other) {
        if (null == other) {
            return this;
        }
        return new Usage(promptTokens + other.getPromptTokens(),
                         completionTokens + other.getCompletionTokens(),
                         totalTokens + other.getTotalTokens());
    }

    /**
     * Sum up usage across a set of responses
     *
     * @param responses Agent responses, null entries and null usages are skipped
     * @return Aggregated usage
     */
    public static Usage sum(final Collection<AgentResponse> responses) {
        return Objects.requireNonNullElseGet(responses, List::<AgentResponse>of)
                .stream()
                .filter(Objects::nonNull)
                .map(AgentResponse::getUsage)
                .reduce(EMPTY, Usage::plus);
    }
}
