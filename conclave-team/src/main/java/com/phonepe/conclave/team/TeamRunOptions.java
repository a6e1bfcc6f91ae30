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

import com.phonepe.conclave.core.agent.CancellationSignal;
import com.phonepe.conclave.core.agent.RunOptions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Options for a single team run
 */
@Value
@Builder
@AllArgsConstructor
public class TeamRunOptions {
    private static final TeamRunOptions NONE = new TeamRunOptions(null);

    /**
     * Forwarded to every agent invocation. Modes also poll it between rounds.
     */
    CancellationSignal signal;

    public static TeamRunOptions none() {
        return NONE;
    }

    public static TeamRunOptions of(CancellationSignal signal) {
        return null == signal ? NONE : new TeamRunOptions(signal);
    }

    public RunOptions toRunOptions() {
        return RunOptions.of(signal);
    }
}
