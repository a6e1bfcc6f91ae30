package com.phonepe.conclave.core.agent;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A tool call made by an agent during its run. Carried through the team untouched.
 */
@Value
@Builder
@Jacksonized
public class ToolCall {
    String toolCallId;
    String toolName;
    /**
     * Arguments as sent by the model, usually serialized json
     */
    String arguments;
}
