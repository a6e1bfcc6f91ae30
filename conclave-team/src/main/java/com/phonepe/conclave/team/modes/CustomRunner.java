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

import com.phonepe.conclave.team.CustomCoordinationFunction;
import com.phonepe.conclave.team.TeamContext;
import com.phonepe.conclave.team.TeamResult;
import com.phonepe.conclave.team.settings.CustomSettings;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Hands the run over to a {@link CustomCoordinationFunction} with a fresh {@link TeamContext}
 */
@Slf4j
public class CustomRunner implements ModeRunner<CustomSettings> {
    public static final String MISSING_FUNCTION_MESSAGE
            = "Custom coordination mode requires a \"coordinationFn\" in the config.";

    @Override
    public TeamResult run(TeamRunContext context, CustomSettings settings) {
        final var function = settings.getCoordinationFunction();
        if (null == function) {
            throw new IllegalArgumentException(MISSING_FUNCTION_MESSAGE);
        }
        final var hooks = context.getHooks();
        hooks.onRoundStart(1);
        final TeamResult result;
        try {
            result = Objects.requireNonNull(function.coordinate(context.getAgents(),
                                                                context.getInput(),
                                                                TeamContext.fresh()),
                                            "Coordination function returned a null result");
        }
        catch (RuntimeException e) {
            log.debug("Coordination function failed: {}", e.getMessage());
            hooks.onError(e);
            throw e;
        }
        hooks.onRoundEnd(1, result.getAgentResults());
        return result;
    }
}
