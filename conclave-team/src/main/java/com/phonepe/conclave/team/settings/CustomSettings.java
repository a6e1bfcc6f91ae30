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
import com.phonepe.conclave.team.CustomCoordinationFunction;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * The whole run is handed over to a user supplied function
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CustomSettings extends ModeSettings {
    CustomCoordinationFunction coordinationFunction;

    @Builder
    public CustomSettings(CustomCoordinationFunction coordinationFunction) {
        super(CoordinationMode.CUSTOM);
        this.coordinationFunction = coordinationFunction;
    }

    public static CustomSettings of(CustomCoordinationFunction coordinationFunction) {
        return new CustomSettings(coordinationFunction);
    }

    @Override
    public <T> T accept(ModeSettingsVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
