package com.phonepe.conclave.core.errors;

import lombok.Getter;

import java.time.Duration;

/**
 * Waiting for an agent exceeded the configured timeout. The agent run itself may still be in progress.
 */
@Getter
public class AgentTimeoutException extends ConclaveException {
    private final String agentName;
    private final Duration timeout;

    public AgentTimeoutException(String agentName, Duration timeout) {
        super(ErrorType.AGENT_TIMEOUT, agentName, timeout.toMillis());
        this.agentName = agentName;
        this.timeout = timeout;
    }
}
