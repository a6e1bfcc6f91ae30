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
import com.phonepe.conclave.team.CoordinationMode;
import com.phonepe.conclave.team.aggregation.AggregationStrategy;
import com.phonepe.conclave.team.aggregation.ResponseReducer;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;
import java.util.Objects;

/**
 * All agents run concurrently on the same input and surviving responses are aggregated
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ParallelSettings extends ModeSettings {
    /**
     * How surviving responses get combined. Defaults to {@link AggregationStrategy#MERGE_ALL}.
     */
    AggregationStrategy aggregationStrategy;

    /**
     * Required for {@link AggregationStrategy#CUSTOM}
     */
    ResponseReducer customReducer;

    /**
     * How long to wait for each agent. No limit if null. Agents that exceed it are dropped from the result but
     * are not cancelled.
     */
    Duration agentTimeout;

    @Builder
    public ParallelSettings(AggregationStrategy aggregationStrategy,
                            ResponseReducer customReducer,
                            Duration agentTimeout) {
        super(CoordinationMode.PARALLEL);
        Preconditions.checkArgument(null == agentTimeout || !(agentTimeout.isNegative() || agentTimeout.isZero()),
                                    "Agent timeout must be positive");
        this.aggregationStrategy = Objects.requireNonNullElse(aggregationStrategy, AggregationStrategy.MERGE_ALL);
        this.customReducer = customReducer;
        this.agentTimeout = agentTimeout;
    }

    public static ParallelSettings of(AggregationStrategy aggregationStrategy) {
        return ParallelSettings.builder()
                .aggregationStrategy(aggregationStrategy)
                .build();
    }

    @Override
    public <T> T accept(ModeSettingsVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
