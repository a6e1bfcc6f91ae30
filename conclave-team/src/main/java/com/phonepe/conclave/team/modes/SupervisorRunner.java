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

import com.phonepe.conclave.core.agent.Agent;
import com.phonepe.conclave.core.agent.AgentResponse;
import com.phonepe.conclave.core.errors.UnknownAgentException;
import com.phonepe.conclave.core.utils.AgentUtils;
import com.phonepe.conclave.team.TeamResult;
import com.phonepe.conclave.team.settings.SupervisorSettings;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A coordinator delegates work to named workers using directives embedded in its output:
 * <ul>
 *     <li>{@code [DELEGATE: <worker>] <instructions>} runs the worker on the instructions this round</li>
 *     <li>{@code [FINAL] <answer>} ends the run with the answer</li>
 * </ul>
 * {@code [FINAL]} takes precedence when both are present. Output with neither directive is the final answer.
 * Worker failures are fed back to the coordinator, coordinator failures fail the run.
 */
@Slf4j
public class SupervisorRunner implements ModeRunner<SupervisorSettings> {
    private static final Pattern DELEGATE_PATTERN = Pattern.compile("\\[DELEGATE:\\s*([^\\]]+)\\]\\s*(.+)");
    private static final Pattern FINAL_PATTERN = Pattern.compile("\\[FINAL\\]\\s*(.*)", Pattern.DOTALL);

    @Value
    static class Delegation {
        String agentName;
        String instructions;
    }

    @Override
    public TeamResult run(TeamRunContext context, SupervisorSettings settings) {
        final var hooks = context.getHooks();
        final Agent coordinator = Objects.requireNonNullElse(settings.getSupervisor(), context.getAgents().get(0));
        final var workers = workers(context, coordinator);
        final var workerNames = List.copyOf(workers.keySet());
        final var allResults = new ArrayList<AgentResponse>();
        var coordinatorInput = initialPrompt(context.getInput(), workerNames);
        var latestCoordinatorText = "";
        var completedRounds = 0;

        for (int round = 1; round <= context.getMaxRounds(); round++) {
            if (context.isAborted()) {
                log.debug("Supervisor run aborted before round {}", round);
                return TeamResult.of(latestCoordinatorText, allResults, completedRounds);
            }
            hooks.onRoundStart(round);
            final var roundResults = new ArrayList<AgentResponse>();
            final var coordinatorResponse = Invocations.invokeOrFail(context, coordinator, coordinatorInput, round);
            allResults.add(coordinatorResponse);
            roundResults.add(coordinatorResponse);
            latestCoordinatorText = coordinatorResponse.getText();

            final var finalAnswer = parseFinal(latestCoordinatorText);
            final var delegations = parseDelegations(latestCoordinatorText);
            if (finalAnswer.isPresent() || delegations.isEmpty()) {
                hooks.onRoundEnd(round, List.copyOf(roundResults));
                return TeamResult.of(finalAnswer.orElse(latestCoordinatorText), allResults, round);
            }

            final var reports = new ArrayList<String>();
            for (final var delegation : delegations) {
                final var workerName = delegation.getAgentName();
                final var worker = workers.get(workerName);
                if (null == worker) {
                    final var error = new UnknownAgentException(workerName, workerNames);
                    log.warn("Coordinator {} delegated to unknown agent {}", coordinator.name(), workerName);
                    hooks.onError(error);
                    reports.add(report(workerName, "Error: " + error.getMessage()));
                    continue;
                }
                hooks.onAgentStart(worker.name(), round);
                final AgentResponse response;
                try {
                    response = AgentUtils.runAndWait(worker, delegation.getInstructions(), context.runOptions());
                }
                catch (RuntimeException e) {
                    log.warn("Worker {} failed in round {}: {}", workerName, round, AgentUtils.errorMessage(e));
                    hooks.onAgentError(worker.name(), e, round);
                    hooks.onError(e);
                    reports.add(report(workerName, "Error: " + AgentUtils.errorMessage(e)));
                    continue;
                }
                allResults.add(response);
                roundResults.add(response);
                reports.add(report(workerName, response.getText()));
                hooks.onAgentEnd(worker.name(), response, round);
            }
            hooks.onRoundEnd(round, List.copyOf(roundResults));
            completedRounds = round;
            coordinatorInput = followUpPrompt(context.getInput(), round, reports);
        }
        log.debug("Supervisor run hit max rounds {} without a final answer", context.getMaxRounds());
        return TeamResult.of(latestCoordinatorText, allResults, context.getMaxRounds());
    }

    /**
     * Every team member other than the coordinator, by name. If the coordinator is not a member, all members are
     * workers.
     */
    private static Map<String, Agent> workers(TeamRunContext context, Agent coordinator) {
        final var workers = new LinkedHashMap<String, Agent>();
        context.getAgents().stream()
                .filter(agent -> !agent.name().equals(coordinator.name()))
                .forEach(agent -> workers.putIfAbsent(agent.name(), agent));
        return workers;
    }

    static Optional<String> parseFinal(String text) {
        final var matcher = FINAL_PATTERN.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1).trim()) : Optional.empty();
    }

    static List<Delegation> parseDelegations(String text) {
        final var delegations = new ArrayList<Delegation>();
        final var matcher = DELEGATE_PATTERN.matcher(text);
        while (matcher.find()) {
            delegations.add(new Delegation(matcher.group(1).trim(), matcher.group(2).trim()));
        }
        return delegations;
    }

    static String initialPrompt(String input, List<String> workerNames) {
        return "You are the supervisor. Delegate tasks to your worker agents or provide a final answer.\n\n"
                + "Available workers: " + String.join(", ", workerNames) + "\n\n"
                + "To delegate, use: [DELEGATE: agentName] task description\n"
                + "To give the final answer, use: [FINAL] your final answer\n\n"
                + "Task: " + input;
    }

    static String followUpPrompt(String input, int round, List<String> reports) {
        return "Worker results from round " + round + ":\n\n"
                + String.join("\n\n", reports)
                + "\n\nOriginal task: " + input + "\n\n"
                + "Continue delegating or provide [FINAL] answer.";
    }

    private static String report(String agentName, String text) {
        return "[" + agentName + "]: " + text;
    }
}
