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

package com.phonepe.conclave.team.communication;

import com.google.common.base.Strings;
import com.phonepe.conclave.core.agent.AgentResponse;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Work passed from one agent to the next, rendered as the receiving agent's input
 */
@Value
@Builder
public class Handoff {
    @NonNull
    String fromAgent;
    @NonNull
    String toAgent;
    @NonNull
    String output;
    String instructions;

    public static Handoff of(@NonNull String fromAgent,
                             @NonNull String toAgent,
                             @NonNull AgentResponse response,
                             String instructions) {
        return new Handoff(fromAgent, toAgent, response.getText(), instructions);
    }

    public String format() {
        final var text = new StringBuilder()
                .append("[Handoff from ")
                .append(fromAgent)
                .append("]\n\n")
                .append(output);
        if (!Strings.isNullOrEmpty(instructions)) {
            text.append("\n\n[Instructions: ")
                    .append(instructions)
                    .append(']');
        }
        return text.toString();
    }
}
