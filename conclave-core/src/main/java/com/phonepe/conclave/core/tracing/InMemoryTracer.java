package com.phonepe.conclave.core.tracing;

import com.phonepe.conclave.core.errors.ErrorType;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps active traces in memory and hands them over to exporters when they end. Safe for use from multiple threads.
 */
@Slf4j
public class InMemoryTracer implements Tracer {
    private final Map<String, Trace> traces = new ConcurrentHashMap<>();
    private final List<TraceExporter> exporters;

    public InMemoryTracer(TraceExporter... exporters) {
        this(List.of(exporters));
    }

    public InMemoryTracer(@NonNull List<TraceExporter> exporters) {
        this.exporters = new CopyOnWriteArrayList<>(exporters);
    }

    public InMemoryTracer addExporter(@NonNull TraceExporter exporter) {
        exporters.add(exporter);
        return this;
    }

    @Override
    public Trace startTrace(@NonNull String name, Map<String, Object> attributes) {
        final var trace = new Trace(newId(), name, System.currentTimeMillis(), attributes);
        traces.put(trace.getId(), trace);
        log.debug("Started trace {} ({})", trace.getName(), trace.getId());
        return trace;
    }

    @Override
    public Span startSpan(String traceId, @NonNull String name, String parentId, Map<String, Object> attributes) {
        final var trace = trace(traceId);
        final var span = new Span(newId(), name, parentId, System.currentTimeMillis(), attributes);
        trace.addSpan(span);
        return span;
    }

    @Override
    public void addEvent(String traceId, String spanId, @NonNull String name, Map<String, Object> attributes) {
        span(traceId, spanId).addEvent(new SpanEvent(name,
                                                     System.currentTimeMillis(),
                                                     null == attributes ? Map.of() : Map.copyOf(attributes)));
    }

    @Override
    public void endSpan(String traceId, String spanId, @NonNull SpanStatus status, Map<String, Object> attributes) {
        span(traceId, spanId).end(System.currentTimeMillis(), status, attributes);
    }

    @Override
    public Trace endTrace(String traceId, Map<String, Object> attributes) {
        final var trace = trace(traceId);
        trace.end(System.currentTimeMillis(), attributes);
        for (final var exporter : exporters) {
            try {
                exporter.export(trace);
            }
            catch (RuntimeException e) {
                log.error("Exporter {} failed for trace {}: {}",
                          exporter.getClass().getSimpleName(), traceId, e.getMessage(), e);
            }
        }
        traces.remove(traceId);
        log.debug("Ended trace {} ({})", trace.getName(), traceId);
        return trace;
    }

    @Override
    public Optional<Trace> findTrace(String traceId) {
        return Optional.ofNullable(traceId).map(traces::get);
    }

    @Override
    public List<Trace> activeTraces() {
        return List.copyOf(traces.values());
    }

    private Trace trace(String traceId) {
        return findTrace(traceId)
                .orElseThrow(() -> new TracingException(ErrorType.TRACE_NOT_FOUND, traceId));
    }

    private Span span(String traceId, String spanId) {
        return trace(traceId).findSpan(spanId)
                .orElseThrow(() -> new TracingException(ErrorType.SPAN_NOT_FOUND, spanId, traceId));
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
