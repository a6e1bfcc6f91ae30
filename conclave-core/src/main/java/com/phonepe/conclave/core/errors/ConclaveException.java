package com.phonepe.conclave.core.errors;

import lombok.Getter;

/**
 * Base for all errors raised by the engine itself. Errors raised by agents are never wrapped in this unless they
 * are checked exceptions.
 */
@Getter
public class ConclaveException extends RuntimeException {
    private final ErrorType errorType;

    public ConclaveException(ErrorType errorType, Object... args) {
        super(errorType.format(args));
        this.errorType = errorType;
    }

    public ConclaveException(ErrorType errorType, Throwable cause, Object... args) {
        super(errorType.format(args), cause);
        this.errorType = errorType;
    }
}
