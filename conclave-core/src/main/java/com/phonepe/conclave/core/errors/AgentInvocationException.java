package com.phonepe.conclave.core.errors;

import lombok.Getter;

/**
 * Raised when an agent run fails with a checked exception or the wait for it was interrupted.
 */
@Getter
public class AgentInvocationException extends ConclaveException {
    private final String agentName;

    public AgentInvocationException(String agentName, Throwable cause) {
        super(ErrorType.AGENT_FAILURE, cause, agentName, cause.getMessage());
        this.agentName = agentName;
    }

    public AgentInvocationException(ErrorType errorType, String agentName, Throwable cause) {
        super(errorType, cause, agentName);
        this.agentName = agentName;
    }
}
