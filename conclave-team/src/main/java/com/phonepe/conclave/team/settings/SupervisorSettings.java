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

import com.phonepe.conclave.core.agent.Agent;
import com.phonepe.conclave.team.CoordinationMode;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * A coordinator delegates work to the other agents by name
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SupervisorSettings extends ModeSettings {
    /**
     * Coordinator. The first agent of the team is used if not set.
     */
    Agent supervisor;

    @Builder
    public SupervisorSettings(Agent supervisor) {
        super(CoordinationMode.SUPERVISOR);
        this.supervisor = supervisor;
    }

    @Override
    public <T> T accept(ModeSettingsVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
