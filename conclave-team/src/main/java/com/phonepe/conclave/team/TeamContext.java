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

import com.phonepe.conclave.core.agent.AgentResponse;
import com.phonepe.conclave.team.communication.Blackboard;
import com.phonepe.conclave.team.communication.MessageBus;
import com.phonepe.conclave.team.communication.TeamMessage;
import lombok.Getter;
import lombok.NonNull;

import java.util.List;

/**
 * Run scoped state handed to custom coordination functions. A fresh context is created for every run and discarded
 * afterwards.
 */
public class TeamContext {
    @Getter
    private final Blackboard blackboard;
    @Getter
    private final MessageBus messageBus;
    private volatile int currentRound;
    private volatile List<AgentResponse> previousResults;

    public TeamContext(@NonNull Blackboard blackboard,
                       @NonNull MessageBus messageBus,
                       int currentRound,
                       List<AgentResponse> previousResults) {
        this.blackboard = blackboard;
        this.messageBus = messageBus;
        this.currentRound = currentRound;
        this.previousResults = null == previousResults ? List.of() : List.copyOf(previousResults);
    }

    public static TeamContext fresh() {
        return new TeamContext(new Blackboard(), new MessageBus(), 1, List.of());
    }

    public int getCurrentRound() {
        return currentRound;
    }

    /**
     * @return Results recorded for the previous round via {@link #recordResults(List)}
     */
    public List<AgentResponse> getPreviousResults() {
        return previousResults;
    }

    public TeamMessage sendMessage(String from, String to, String content) {
        return messageBus.send(from, to, content);
    }

    public List<TeamMessage> getMessages(String agentName) {
        return messageBus.messagesFor(agentName);
    }

    /**
     * Move to the next round
     *
     * @return The new round number
     */
    public int nextRound() {
        return ++currentRound;
    }

    public void recordResults(List<AgentResponse> results) {
        this.previousResults = null == results ? List.of() : List.copyOf(results);
    }
}
