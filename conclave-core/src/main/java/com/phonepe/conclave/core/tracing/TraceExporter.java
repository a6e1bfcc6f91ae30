package com.phonepe.conclave.core.tracing;

/**
 * Receives traces once they have ended
 */
@FunctionalInterface
public interface TraceExporter {
    void export(Trace trace);
}
