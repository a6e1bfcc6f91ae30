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

import com.phonepe.conclave.core.agent.AgentResponse;
import com.phonepe.conclave.core.errors.AgentTimeoutException;
import com.phonepe.conclave.core.utils.AgentUtils;
import com.phonepe.conclave.team.AgentRole;
import com.phonepe.conclave.team.TeamResult;
import com.phonepe.conclave.team.aggregation.Aggregation;
import com.phonepe.conclave.team.settings.ParallelSettings;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans the same input out to all agents at once and aggregates whatever succeeds. A failing or slow agent is
 * dropped from the result without affecting the others.
 */
@Slf4j
public class ParallelRunner implements ModeRunner<ParallelSettings> {

    @Value
    private static class Outcome {
        AgentRole agent;
        AgentResponse response;
        Throwable error;
    }

    @Override
    public TeamResult run(TeamRunContext context, ParallelSettings settings) {
        final var hooks = context.getHooks();
        final var agents = context.getAgents();

        hooks.onRoundStart(1);
        agents.forEach(agent -> hooks.onAgentStart(agent.name(), 1));

        final var futures = agents.stream()
                .map(agent -> start(context, agent, settings.getAgentTimeout()))
                .toList();

        // Reported in team order, each as soon as it and the agents before it have settled
        final var successes = new ArrayList<AgentResponse>();
        for (final var future : futures) {
            final var outcome = future.join();
            if (null != outcome.getError()) {
                log.warn("Agent {} dropped from parallel run: {}",
                         outcome.getAgent().name(), AgentUtils.errorMessage(outcome.getError()));
                hooks.onAgentError(outcome.getAgent().name(), outcome.getError(), 1);
                hooks.onError(outcome.getError());
                continue;
            }
            successes.add(outcome.getResponse());
            hooks.onAgentEnd(outcome.getAgent().name(), outcome.getResponse(), 1);
        }
        hooks.onRoundEnd(1, List.copyOf(successes));

        final var finalOutput = Aggregation.aggregate(settings.getAggregationStrategy(),
                                                      successes,
                                                      settings.getCustomReducer());
        return TeamResult.of(finalOutput, successes, 1);
    }

    /**
     * Start the agent and map its completion into an outcome. The timeout applies to a copy of the agent's future
     * so the agent's own run is never cancelled.
     */
    private static CompletableFuture<Outcome> start(TeamRunContext context, AgentRole agent, Duration timeout) {
        CompletableFuture<AgentResponse> future;
        try {
            future = agent.run(context.getInput(), context.runOptions());
            if (null == future) {
                future = CompletableFuture.failedFuture(
                        new IllegalStateException("Agent " + agent.name() + " returned a null future"));
            }
        }
        catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (null != timeout) {
            future = future.copy().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return future.handle((response, error) -> {
            if (null == error) {
                return null == response
                       ? new Outcome(agent, null, new IllegalStateException(
                               "Agent " + agent.name() + " returned no response"))
                       : new Outcome(agent, response, null);
            }
            final var cause = AgentUtils.unwrap(error);
            if (null != timeout && cause instanceof TimeoutException) {
                return new Outcome(agent, null, new AgentTimeoutException(agent.name(), timeout));
            }
            return new Outcome(agent, null, cause);
        });
    }
}
