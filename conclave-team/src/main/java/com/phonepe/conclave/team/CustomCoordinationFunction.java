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

import java.util.List;

/**
 * User supplied coordination strategy. The engine does no looping for custom teams; the function owns the whole
 * run and may use the {@link TeamContext} to keep state across its own rounds.
 */
@FunctionalInterface
public interface CustomCoordinationFunction {
    TeamResult coordinate(List<AgentRole> agents, String input, TeamContext context);
}
