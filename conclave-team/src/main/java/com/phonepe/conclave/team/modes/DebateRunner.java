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
import com.phonepe.conclave.team.TeamResult;
import com.phonepe.conclave.team.aggregation.Aggregation;
import com.phonepe.conclave.team.settings.DebateSettings;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Agents argue over several rounds, each seeing every earlier argument. Stops early once all agents say the same
 * thing. Any agent failure fails the whole debate.
 */
@Slf4j
public class DebateRunner implements ModeRunner<DebateSettings> {

    @Value
    private static class Argument {
        int round;
        String agentName;
        String text;
    }

    @Override
    public TeamResult run(TeamRunContext context, DebateSettings settings) {
        final var hooks = context.getHooks();
        final var rounds = Objects.requireNonNullElse(settings.getRounds(), context.getMaxRounds());
        final var allResults = new ArrayList<AgentResponse>();
        final var history = new ArrayList<Argument>();
        var lastRound = List.<AgentResponse>of();
        var completedRounds = 0;

        for (int round = 1; round <= rounds; round++) {
            if (context.isAborted()) {
                log.debug("Debate aborted before round {}", round);
                return TeamResult.of(mergeRound(lastRound), allResults, completedRounds);
            }
            hooks.onRoundStart(round);
            final var roundResults = new ArrayList<AgentResponse>();
            for (final var role : context.getAgents()) {
                final var prompt = debatePrompt(context.getInput(), history, round);
                final var response = Invocations.invokeOrFail(context, role, prompt, round);
                roundResults.add(response);
                allResults.add(response);
                history.add(new Argument(round, role.name(), response.getText()));
            }
            hooks.onRoundEnd(round, List.copyOf(roundResults));
            completedRounds = round;
            lastRound = roundResults;

            if (hasConverged(roundResults)) {
                final var consensus = roundResults.get(0).getText();
                log.debug("Debate converged in round {}", round);
                hooks.onConsensus(round, consensus);
                return TeamResult.of(consensus, allResults, round);
            }
        }

        final var judge = settings.getJudge();
        if (null == judge) {
            return TeamResult.of(mergeRound(lastRound), allResults, rounds);
        }
        final var verdict = Invocations.invokeOrFail(context, judge, judgePrompt(context.getInput(), history),
                                                     rounds + 1);
        allResults.add(verdict);
        return TeamResult.of(verdict.getText(), allResults, rounds);
    }

    /**
     * All trimmed outputs are identical. A single response is trivially converged.
     */
    static boolean hasConverged(List<AgentResponse> responses) {
        if (responses.size() <= 1) {
            return true;
        }
        final var first = responses.get(0).getText().trim();
        return responses.stream().allMatch(response -> response.getText().trim().equals(first));
    }

    static String debatePrompt(String input, List<Argument> history, int round) {
        final var prompt = new StringBuilder()
                .append("Original question: ")
                .append(input)
                .append("\n\n");
        if (history.isEmpty()) {
            return prompt.append("Round ")
                    .append(round)
                    .append(": Please provide your initial argument.")
                    .toString();
        }
        prompt.append("Previous arguments:\n");
        appendArguments(prompt, history);
        return prompt.append("\nRound ")
                .append(round)
                .append(": Please provide your argument, considering all previous positions.")
                .toString();
    }

    static String judgePrompt(String input, List<Argument> history) {
        final var prompt = new StringBuilder()
                .append("You are the judge. The following debate has concluded without consensus.\n\n")
                .append("Original question: ")
                .append(input)
                .append("\n\nArguments:\n");
        appendArguments(prompt, history);
        return prompt.append("\nPlease evaluate the arguments and provide your final verdict.")
                .toString();
    }

    private static void appendArguments(StringBuilder prompt, List<Argument> history) {
        history.forEach(argument -> prompt.append("\n[Round ")
                .append(argument.getRound())
                .append(" - ")
                .append(argument.getAgentName())
                .append("]: ")
                .append(argument.getText())
                .append('\n'));
    }

    private static String mergeRound(List<AgentResponse> responses) {
        return Aggregation.mergeAll(responses);
    }
}
