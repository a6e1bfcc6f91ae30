package com.phonepe.conclave.core.tracing;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records traces and nested spans for observability.
 * All operations on unknown trace or span ids raise {@link TracingException}.
 */
public interface Tracer {

    Trace startTrace(String name, Map<String, Object> attributes);

    Span startSpan(String traceId, String name, String parentId, Map<String, Object> attributes);

    void addEvent(String traceId, String spanId, String name, Map<String, Object> attributes);

    void endSpan(String traceId, String spanId, SpanStatus status, Map<String, Object> attributes);

    /**
     * End the trace, hand it over to exporters and stop tracking it.
     *
     * @param traceId    Trace id
     * @param attributes Attributes to merge into the trace
     * @return The finished trace
     */
    Trace endTrace(String traceId, Map<String, Object> attributes);

    Optional<Trace> findTrace(String traceId);

    List<Trace> activeTraces();

    default Trace startTrace(String name) {
        return startTrace(name, Map.of());
    }

    default Span startSpan(String traceId, String name) {
        return startSpan(traceId, name, null, Map.of());
    }

    default Span startSpan(String traceId, String name, String parentId) {
        return startSpan(traceId, name, parentId, Map.of());
    }

    default void endSpan(String traceId, String spanId, SpanStatus status) {
        endSpan(traceId, spanId, status, Map.of());
    }

    default Trace endTrace(String traceId) {
        return endTrace(traceId, Map.of());
    }
}
