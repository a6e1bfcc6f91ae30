package com.phonepe.conclave.core.agent;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Options passed to an agent for a single run
 */
@Value
@Builder
@AllArgsConstructor
public class RunOptions {
    private static final RunOptions NONE = new RunOptions(null);

    /**
     * Signal to cooperatively cancel the run. Can be null.
     */
    CancellationSignal signal;

    public static RunOptions none() {
        return NONE;
    }

    public static RunOptions of(CancellationSignal signal) {
        return null == signal ? NONE : new RunOptions(signal);
    }

    public boolean isAborted() {
        return CancellationSignal.aborted(signal);
    }
}
