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

package com.phonepe.conclave.team.utils;

import com.phonepe.conclave.core.agent.Agent;
import com.phonepe.conclave.core.agent.AgentResponse;
import com.phonepe.conclave.core.agent.RunOptions;
import com.phonepe.conclave.core.model.Usage;
import lombok.Getter;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Agent with canned behaviour that records every input it receives
 */
public class ScriptedAgent implements Agent {
    public static final Usage USAGE = Usage.of(10, 5);

    private final String name;
    private final Function<String, CompletableFuture<AgentResponse>> behaviour;
    @Getter
    private final List<String> inputs = new CopyOnWriteArrayList<>();
    @Getter
    private final List<RunOptions> options = new CopyOnWriteArrayList<>();
    @Getter
    private final List<CompletableFuture<AgentResponse>> futures = new CopyOnWriteArrayList<>();

    public ScriptedAgent(String name, Function<String, CompletableFuture<AgentResponse>> behaviour) {
        this.name = name;
        this.behaviour = behaviour;
    }

    public static ScriptedAgent replying(String name, String text) {
        return answering(name, input -> text);
    }

    public static ScriptedAgent answering(String name, Function<String, String> answer) {
        return new ScriptedAgent(name, input -> CompletableFuture.completedFuture(response(name, answer.apply(input))));
    }

    /**
     * Replies with the given texts in order. The last text is repeated once the script runs out.
     */
    public static ScriptedAgent scripted(String name, String... texts) {
        final var counter = new AtomicInteger();
        return answering(name, input -> texts[Math.min(counter.getAndIncrement(), texts.length - 1)]);
    }

    public static ScriptedAgent failing(String name, RuntimeException error) {
        return new ScriptedAgent(name, input -> CompletableFuture.failedFuture(error));
    }

    public static ScriptedAgent delayed(String name, String text, Duration delay) {
        return new ScriptedAgent(name, input -> CompletableFuture.supplyAsync(
                () -> response(name, text),
                CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)));
    }

    public static ScriptedAgent hanging(String name) {
        return new ScriptedAgent(name, input -> new CompletableFuture<>());
    }

    public static AgentResponse response(String name, String text) {
        return AgentResponse.of(name, text, USAGE);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletableFuture<AgentResponse> run(String input, RunOptions options) {
        inputs.add(input);
        this.options.add(options);
        final var future = behaviour.apply(input);
        futures.add(future);
        return future;
    }

    public int invocations() {
        return inputs.size();
    }

    public String lastInput() {
        return inputs.get(inputs.size() - 1);
    }
}
