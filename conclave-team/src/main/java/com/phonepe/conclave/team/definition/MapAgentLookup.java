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

import com.phonepe.conclave.core.agent.Agent;
import lombok.NonNull;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link AgentLookup}. Registering an agent with an existing name replaces it.
 */
public class MapAgentLookup implements AgentLookup {
    private final Map<String, Agent> agents = new ConcurrentHashMap<>();

    public static MapAgentLookup of(Agent... agents) {
        final var lookup = new MapAgentLookup();
        for (final var agent : agents) {
            lookup.register(agent);
        }
        return lookup;
    }

    public MapAgentLookup register(@NonNull Agent agent) {
        agents.put(agent.name(), agent);
        return this;
    }

    public boolean remove(String agentName) {
        return agents.remove(agentName) != null;
    }

    public Set<String> names() {
        return Set.copyOf(agents.keySet());
    }

    @Override
    public Optional<Agent> find(String agentName) {
        return Optional.ofNullable(agentName).map(agents::get);
    }
}
