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

import com.google.common.base.Preconditions;
import com.phonepe.conclave.core.agent.Agent;
import com.phonepe.conclave.core.tracing.Tracer;
import com.phonepe.conclave.team.settings.ModeSettings;
import com.phonepe.conclave.team.settings.SequentialSettings;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Configuration for a team. The coordination mode is derived from the {@link ModeSettings} variant.
 */
@Value
@Builder
@With
public class TeamConfig {
    public static final int DEFAULT_MAX_ROUNDS = 10;

    @NonNull
    String name;

    /**
     * Members in team order. Plain agents added through the builder get wrapped as members.
     */
    @Singular("role")
    List<AgentRole> agents;

    @NonNull
    @Builder.Default
    ModeSettings modeSettings = SequentialSettings.INSTANCE;

    /**
     * Upper limit on rounds for modes that loop
     */
    @Builder.Default
    int maxRounds = DEFAULT_MAX_ROUNDS;

    TeamHooks hooks;

    Tracer tracer;

    /**
     * Executor backing asynchronous runs. A cached thread pool is created if not provided.
     */
    ExecutorService executorService;

    public CoordinationMode getCoordinationMode() {
        return modeSettings.getMode();
    }

    @SuppressWarnings("unused")
    public static class TeamConfigBuilder {
        public TeamConfigBuilder agent(@NonNull Agent agent) {
            return role(AgentRole.of(agent));
        }

        /**
         * Add a mix of plain agents and roles, preserving order
         */
        public TeamConfigBuilder members(@NonNull List<? extends Agent> members) {
            members.forEach(this::agent);
            return this;
        }
    }

    /**
     * Checks settings that do not depend on the mode
     */
    void validate() {
        Preconditions.checkArgument(!agents.isEmpty(), "A team requires at least one agent.");
        Preconditions.checkArgument(maxRounds > 0, "Max rounds must be positive");
    }
}
