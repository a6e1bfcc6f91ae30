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

import java.util.List;

/**
 * Lifecycle callbacks fired while a team runs. Hooks are invoked on the thread running the team and an exception
 * thrown from a hook fails the run.
 */
public interface TeamHooks {
    TeamHooks NONE = new TeamHooks() {
    };

    default void onRoundStart(int round) {
    }

    default void onAgentStart(String agentName, int round) {
    }

    default void onAgentEnd(String agentName, AgentResponse response, int round) {
    }

    default void onRoundEnd(int round, List<AgentResponse> results) {
    }

    /**
     * Debate agents agreed on an output
     */
    default void onConsensus(int round, String output) {
    }

    /**
     * An agent started through {@link #onAgentStart(String, int)} failed. Fired right before {@link #onError(Throwable)}
     * for the same error.
     */
    default void onAgentError(String agentName, Throwable error, int round) {
    }

    default void onError(Throwable error) {
    }
}
