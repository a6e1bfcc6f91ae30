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

import com.phonepe.conclave.core.agent.CancellationSignal;
import com.phonepe.conclave.core.agent.RunOptions;
import com.phonepe.conclave.team.AgentRole;
import com.phonepe.conclave.team.TeamHooks;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Everything a mode runner needs for one run, apart from its mode specific settings
 */
@Value
@Builder
public class TeamRunContext {
    @NonNull
    List<AgentRole> agents;

    @NonNull
    String input;

    int maxRounds;

    @NonNull
    @Builder.Default
    TeamHooks hooks = TeamHooks.NONE;

    CancellationSignal signal;

    public boolean isAborted() {
        return CancellationSignal.aborted(signal);
    }

    public RunOptions runOptions() {
        return RunOptions.of(signal);
    }
}
