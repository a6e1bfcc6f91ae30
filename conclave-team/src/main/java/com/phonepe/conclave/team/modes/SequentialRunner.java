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

import com.phonepe.conclave.core.agent.AgentResponse;
import com.phonepe.conclave.team.TeamResult;
import com.phonepe.conclave.team.settings.SequentialSettings;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;

/**
 * Pipeline: every agent gets the previous agent's output as input
 */
@Slf4j
public class SequentialRunner implements ModeRunner<SequentialSettings> {

    @Override
    public TeamResult run(TeamRunContext context, SequentialSettings settings) {
        final var hooks = context.getHooks();
        final var results = new ArrayList<AgentResponse>();
        var currentInput = context.getInput();

        hooks.onRoundStart(1);
        for (final var role : context.getAgents()) {
            if (context.isAborted()) {
                log.debug("Run aborted before agent {}", role.name());
                break;
            }
            final var response = Invocations.invokeOrFail(context, role, currentInput, 1);
            results.add(response);
            currentInput = response.getText();
        }
        hooks.onRoundEnd(1, results);

        final var finalOutput = results.isEmpty() ? "" : results.get(results.size() - 1).getText();
        return TeamResult.of(finalOutput, results, 1);
    }
}
