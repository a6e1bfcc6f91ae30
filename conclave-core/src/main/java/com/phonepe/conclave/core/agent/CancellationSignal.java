package com.phonepe.conclave.core.agent;

import lombok.ToString;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag shared between the caller and running agents/teams. Nothing is interrupted when
 * the signal is raised, participants are expected to poll {@link #isAborted()} at safe points.
 */
@ToString
public class CancellationSignal {
    private static final String DEFAULT_REASON = "Aborted";

    private final AtomicReference<String> reason = new AtomicReference<>();

    public void abort() {
        abort(DEFAULT_REASON);
    }

    /**
     * Raise the signal. Only the first reason is retained.
     *
     * @param reason Why the run is being aborted
     */
    public void abort(String reason) {
        this.reason.compareAndSet(null, null == reason ? DEFAULT_REASON : reason);
    }

    public boolean isAborted() {
        return reason.get() != null;
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason.get());
    }

    /**
     * Null safe check on a signal that may not have been provided
     */
    public static boolean aborted(CancellationSignal signal) {
        return null != signal && signal.isAborted();
    }
}
