package com.phonepe.conclave.core.tracing;

import com.phonepe.conclave.core.errors.ConclaveException;
import com.phonepe.conclave.core.errors.ErrorType;

/**
 * Tracer was asked to operate on a trace or span it does not know about
 */
public class TracingException extends ConclaveException {
    public TracingException(ErrorType errorType, Object... args) {
        super(errorType, args);
    }
}
