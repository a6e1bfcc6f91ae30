package com.phonepe.conclave.core.agent;

import com.phonepe.conclave.core.model.Usage;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Response from a single agent run
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class AgentResponse {
    /**
     * Final text produced by the agent
     */
    @NonNull
    String text;

    /**
     * Tool calls made by the agent while producing the text
     */
    @Singular
    List<ToolCall> toolCalls;

    /**
     * Aggregated usage across all model calls made by the agent
     */
    @Builder.Default
    Usage usage = Usage.empty();

    /**
     * Name of the agent that generated this response
     */
    @NonNull
    String agentName;

    public static AgentResponse of(String agentName, String text, Usage usage) {
        return AgentResponse.builder()
                .agentName(agentName)
                .text(text)
                .usage(usage)
                .build();
    }
}
