package com.phonepe.conclave.core.tracing.exporters;

import com.phonepe.conclave.core.tracing.Trace;
import com.phonepe.conclave.core.tracing.TraceExporter;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps finished traces in memory for programmatic access
 */
public class CollectingTraceExporter implements TraceExporter {
    private final List<Trace> traces = new CopyOnWriteArrayList<>();

    @Override
    public void export(Trace trace) {
        traces.add(trace);
    }

    public List<Trace> getTraces() {
        return List.copyOf(traces);
    }

    public Optional<Trace> last() {
        return traces.isEmpty() ? Optional.empty() : Optional.of(traces.get(traces.size() - 1));
    }

    public void clear() {
        traces.clear();
    }
}
