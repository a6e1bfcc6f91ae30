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

package com.phonepe.conclave.team.settings;

import com.google.common.base.Preconditions;
import com.phonepe.conclave.core.agent.Agent;
import com.phonepe.conclave.team.CoordinationMode;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * Agents argue over multiple rounds till they converge or the rounds run out
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DebateSettings extends ModeSettings {
    /**
     * Decides the outcome when the debate ends without consensus. Optional.
     */
    Agent judge;

    /**
     * Number of rounds. Falls back to the team's max rounds if null.
     */
    Integer rounds;

    @Builder
    public DebateSettings(Agent judge, Integer rounds) {
        super(CoordinationMode.DEBATE);
        Preconditions.checkArgument(null == rounds || rounds > 0, "Debate rounds must be positive");
        this.judge = judge;
        this.rounds = rounds;
    }

    @Override
    public <T> T accept(ModeSettingsVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
