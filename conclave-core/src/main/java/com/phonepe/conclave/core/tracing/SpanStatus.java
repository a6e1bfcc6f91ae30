package com.phonepe.conclave.core.tracing;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a completed span
 */
@Getter
@AllArgsConstructor
public enum SpanStatus {
    OK("ok"),
    ERROR("error"),
    ;

    @JsonValue
    private final String value;
}
