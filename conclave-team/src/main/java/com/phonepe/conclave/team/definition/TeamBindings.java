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

package com.phonepe.conclave.team.definition;

import com.phonepe.conclave.core.tracing.Tracer;
import com.phonepe.conclave.team.CustomCoordinationFunction;
import com.phonepe.conclave.team.TeamHooks;
import com.phonepe.conclave.team.aggregation.ResponseReducer;
import lombok.Builder;
import lombok.Value;

import java.util.concurrent.ExecutorService;

/**
 * Runtime objects that cannot be expressed in a {@link TeamDefinition}
 */
@Value
@Builder
public class TeamBindings {
    public static final TeamBindings NONE = TeamBindings.builder().build();

    TeamHooks hooks;
    Tracer tracer;
    ResponseReducer customReducer;
    CustomCoordinationFunction coordinationFunction;
    ExecutorService executorService;
}
