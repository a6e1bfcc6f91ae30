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

package com.phonepe.conclave.team.modes;

import com.phonepe.conclave.core.agent.Agent;
import com.phonepe.conclave.core.agent.AgentResponse;
import com.phonepe.conclave.core.utils.AgentUtils;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Agent invocation helpers shared by the runners
 */
@Slf4j
@UtilityClass
class Invocations {

    /**
     * Run an agent and wait for it. Agent start and end hooks fire around the call. On failure the error hook
     * fires and the agent's exception is rethrown.
     */
    static AgentResponse invokeOrFail(TeamRunContext context, Agent agent, String input, int round) {
        final var hooks = context.getHooks();
        hooks.onAgentStart(agent.name(), round);
        final AgentResponse response;
        try {
            response = AgentUtils.runAndWait(agent, input, context.runOptions());
        }
        catch (RuntimeException e) {
            log.debug("Agent {} failed in round {}: {}", agent.name(), round, AgentUtils.errorMessage(e));
            hooks.onAgentError(agent.name(), e, round);
            hooks.onError(e);
            throw e;
        }
        hooks.onAgentEnd(agent.name(), response, round);
        return response;
    }
}
