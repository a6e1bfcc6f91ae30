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
import com.phonepe.conclave.team.modes.CustomRunner;
import com.phonepe.conclave.team.settings.CustomSettings;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point to build teams
 */
@Slf4j
@UtilityClass
public class Teams {

    /**
     * Build a team from the configuration. All configuration errors surface here, before any agent can run.
     *
     * @param config Team configuration
     * @return Team ready to run
     * @throws IllegalArgumentException if the configuration is not usable
     */
    public static Team create(@NonNull TeamConfig config) {
        final var team = new Team(config);
        if (config.getModeSettings() instanceof CustomSettings customSettings) {
            Preconditions.checkArgument(null != customSettings.getCoordinationFunction(),
                                        CustomRunner.MISSING_FUNCTION_MESSAGE);
        }
        log.debug("Created team {} with {} agents in {} mode",
                  team.getName(), team.getAgents().size(), team.getCoordinationMode().getValue());
        return team;
    }
}
