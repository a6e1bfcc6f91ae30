package com.phonepe.conclave.core.agent;

import java.util.concurrent.CompletableFuture;

/**
 * An independently executing worker. Text goes in, a response with text, tool calls and usage comes out.
 * How the response is produced (model calls, tools, guardrails) is entirely up to the implementation.
 */
public interface Agent {
    /**
     * @return Name of the agent. Used as the identity of the agent within a team.
     */
    String name();

    /**
     * Run the agent on the provided input.
     *
     * @param input   Text input for the agent
     * @param options Run options. Implementations are expected to honour the cancellation signal if present.
     * @return Future that completes with the response, or exceptionally if the run failed
     */
    CompletableFuture<AgentResponse> run(String input, RunOptions options);

    default CompletableFuture<AgentResponse> run(String input) {
        return run(input, RunOptions.none());
    }
}
