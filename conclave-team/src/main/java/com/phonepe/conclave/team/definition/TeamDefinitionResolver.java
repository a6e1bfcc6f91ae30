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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.phonepe.conclave.core.agent.Agent;
import com.phonepe.conclave.team.AgentRole;
import com.phonepe.conclave.team.CoordinationMode;
import com.phonepe.conclave.team.Team;
import com.phonepe.conclave.team.TeamConfig;
import com.phonepe.conclave.team.Teams;
import com.phonepe.conclave.team.settings.CustomSettings;
import com.phonepe.conclave.team.settings.DebateSettings;
import com.phonepe.conclave.team.settings.ModeSettings;
import com.phonepe.conclave.team.settings.ParallelSettings;
import com.phonepe.conclave.team.settings.SequentialSettings;
import com.phonepe.conclave.team.settings.SupervisorSettings;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;

/**
 * Turns {@link TeamDefinition}s into runnable team configuration by looking up agents by name
 */
@Slf4j
public class TeamDefinitionResolver {
    private final AgentLookup agentLookup;

    public TeamDefinitionResolver(@NonNull AgentLookup agentLookup) {
        this.agentLookup = agentLookup;
    }

    public TeamConfig resolve(TeamDefinition definition) {
        return resolve(definition, TeamBindings.NONE);
    }

    /**
     * Build team configuration from the definition
     *
     * @param definition Team definition
     * @param bindings   Hooks, tracer and functions to attach to the team
     * @return Team configuration
     * @throws IllegalArgumentException for unknown modes or agents
     */
    public TeamConfig resolve(@NonNull TeamDefinition definition, TeamBindings bindings) {
        final var runtime = Objects.requireNonNullElse(bindings, TeamBindings.NONE);
        final var mode = CoordinationMode.fromValue(definition.getCoordinationMode());
        final var builder = TeamConfig.builder()
                .name(definition.getName())
                .modeSettings(modeSettings(mode, definition, runtime))
                .hooks(runtime.getHooks())
                .tracer(runtime.getTracer())
                .executorService(runtime.getExecutorService());
        if (null != definition.getMaxRounds()) {
            builder.maxRounds(definition.getMaxRounds());
        }
        definition.getMembers()
                .forEach(member -> builder.role(AgentRole.builder()
                                                        .agent(agent(member.getAgent()))
                                                        .role(Strings.isNullOrEmpty(member.getRole())
                                                              ? AgentRole.DEFAULT_ROLE
                                                              : member.getRole())
                                                        .description(member.getDescription())
                                                        .canDelegate(member.isCanDelegate())
                                                        .build()));
        log.debug("Resolved team definition {} with {} members", definition.getName(), definition.getMembers().size());
        return builder.build();
    }

    /**
     * Resolve the definition and create the team
     */
    public Team create(TeamDefinition definition, TeamBindings bindings) {
        return Teams.create(resolve(definition, bindings));
    }

    private ModeSettings modeSettings(CoordinationMode mode, TeamDefinition definition, TeamBindings bindings) {
        return switch (mode) {
            case SEQUENTIAL -> SequentialSettings.INSTANCE;
            case PARALLEL -> ParallelSettings.builder()
                    .aggregationStrategy(definition.getAggregationStrategy())
                    .customReducer(bindings.getCustomReducer())
                    .agentTimeout(null == definition.getAgentTimeoutMs()
                                  ? null
                                  : Duration.ofMillis(definition.getAgentTimeoutMs()))
                    .build();
            case DEBATE -> DebateSettings.builder()
                    .judge(optionalAgent(definition.getJudge()))
                    .rounds(definition.getRounds())
                    .build();
            case SUPERVISOR -> SupervisorSettings.builder()
                    .supervisor(optionalAgent(definition.getSupervisor()))
                    .build();
            case CUSTOM -> CustomSettings.of(bindings.getCoordinationFunction());
        };
    }

    private Agent optionalAgent(String agentName) {
        return Strings.isNullOrEmpty(agentName) ? null : agent(agentName);
    }

    private Agent agent(String agentName) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(agentName), "Agent name is required for team members");
        return agentLookup.find(agentName)
                .orElseThrow(() -> new IllegalArgumentException("No agent registered with name: " + agentName));
    }
}
