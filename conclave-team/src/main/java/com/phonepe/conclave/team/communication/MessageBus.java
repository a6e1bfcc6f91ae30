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

package com.phonepe.conclave.team.communication;

import lombok.NonNull;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Append only log of messages between team members for a single run
 */
public class MessageBus {
    private final List<TeamMessage> messages = new CopyOnWriteArrayList<>();

    public TeamMessage send(@NonNull String from, @NonNull String to, @NonNull String content) {
        final var message = new TeamMessage(from, to, content, System.currentTimeMillis());
        messages.add(message);
        return message;
    }

    /**
     * @return Messages addressed to the agent, oldest first
     */
    public List<TeamMessage> messagesFor(String agentName) {
        return filter(message -> message.getTo().equals(agentName));
    }

    public List<TeamMessage> messagesFrom(String agentName) {
        return filter(message -> message.getFrom().equals(agentName));
    }

    public List<TeamMessage> all() {
        return List.copyOf(messages);
    }

    public void clear() {
        messages.clear();
    }

    private List<TeamMessage> filter(Predicate<TeamMessage> predicate) {
        return messages.stream()
                .filter(predicate)
                .toList();
    }
}
