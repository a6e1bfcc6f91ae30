package com.phonepe.conclave.core.errors;

import lombok.Getter;

import java.util.List;

/**
 * A directive referred to an agent that is not part of the team
 */
@Getter
public class UnknownAgentException extends ConclaveException {
    private final String agentName;
    private final List<String> available;

    public UnknownAgentException(String agentName, List<String> available) {
        super(ErrorType.UNKNOWN_WORKER, agentName, String.join(", ", available));
        this.agentName = agentName;
        this.available = List.copyOf(available);
    }
}
