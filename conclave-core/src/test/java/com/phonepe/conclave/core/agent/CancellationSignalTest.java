package com.phonepe.conclave.core.agent;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {

    @Test
    void notAbortedByDefault() {
        final var signal = new CancellationSignal();
        assertFalse(signal.isAborted());
        assertTrue(signal.getReason().isEmpty());
        assertFalse(RunOptions.of(signal).isAborted());
    }

    @Test
    void firstReasonWins() {
        final var signal = new CancellationSignal();
        signal.abort("user cancelled");
        signal.abort("second");
        assertAll(
                () -> assertTrue(signal.isAborted()),
                () -> assertEquals("user cancelled", signal.getReason().orElseThrow()),
                () -> assertTrue(RunOptions.of(signal).isAborted())
                 );
    }

    @Test
    void nullSafeCheck() {
        assertFalse(CancellationSignal.aborted(null));
        assertSame(RunOptions.none(), RunOptions.of(null));
        assertFalse(RunOptions.none().isAborted());
    }
}
