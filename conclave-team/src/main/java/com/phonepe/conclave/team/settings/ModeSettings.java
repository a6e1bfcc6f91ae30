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

import com.phonepe.conclave.team.CoordinationMode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Mode specific configuration of a team. The variant decides the coordination mode.
 */
@EqualsAndHashCode
@ToString
@Getter
public abstract class ModeSettings {
    private final CoordinationMode mode;

    protected ModeSettings(@NonNull CoordinationMode mode) {
        this.mode = mode;
    }

    public abstract <T> T accept(ModeSettingsVisitor<T> visitor);
}
