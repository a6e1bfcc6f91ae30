package com.phonepe.conclave.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Failure categories raised by the engine. Messages are format templates.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    AGENT_FAILURE("Agent %s failed with error: %s"),
    AGENT_TIMEOUT("Agent \"%s\" timed out after %dms"),
    AGENT_INTERRUPTED("Interrupted while waiting for agent %s"),
    UNKNOWN_WORKER("Agent \"%s\" not found. Available: %s"),
    TRACE_NOT_FOUND("Trace \"%s\" not found."),
    SPAN_NOT_FOUND("Span \"%s\" not found in trace \"%s\"."),
    SERIALIZATION_ERROR("Error serializing object to JSON. Error: %s"),
    ;

    private final String message;

    public String format(Object... args) {
        return String.format(message, args);
    }
}
