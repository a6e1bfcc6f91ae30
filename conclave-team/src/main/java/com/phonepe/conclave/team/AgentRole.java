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

import com.phonepe.conclave.core.agent.Agent;
import com.phonepe.conclave.core.agent.AgentResponse;
import com.phonepe.conclave.core.agent.RunOptions;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.concurrent.CompletableFuture;

/**
 * An agent together with the role it plays in a team. Runs delegate to the wrapped agent.
 */
@Value
@Builder
public class AgentRole implements Agent {
    public static final String DEFAULT_ROLE = "member";

    @NonNull
    Agent agent;

    @NonNull
    @Builder.Default
    String role = DEFAULT_ROLE;

    String description;

    boolean canDelegate;

    /**
     * Wrap a plain agent as a team member. Roles are returned unchanged.
     */
    public static AgentRole of(@NonNull Agent agent) {
        if (agent instanceof AgentRole agentRole) {
            return agentRole;
        }
        return AgentRole.builder()
                .agent(agent)
                .build();
    }

    public static AgentRole of(@NonNull Agent agent, @NonNull String role) {
        return AgentRole.builder()
                .agent(agent)
                .role(role)
                .build();
    }

    @Override
    public String name() {
        return agent.name();
    }

    @Override
    public CompletableFuture<AgentResponse> run(String input, RunOptions options) {
        return agent.run(input, options);
    }
}
