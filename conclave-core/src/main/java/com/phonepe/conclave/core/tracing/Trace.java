package com.phonepe.conclave.core.tracing;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Root container grouping all spans recorded for one unit of work
 */
@Getter
@ToString
public class Trace {
    private final String id;
    private final String name;
    private final long startTime;
    private final List<Span> spans = new CopyOnWriteArrayList<>();
    private final Map<String, Object> attributes = Collections.synchronizedMap(new LinkedHashMap<>());
    private volatile Long endTime;

    Trace(String id, String name, long startTime, Map<String, Object> attributes) {
        this.id = id;
        this.name = name;
        this.startTime = startTime;
        if (null != attributes) {
            this.attributes.putAll(attributes);
        }
    }

    public Optional<Span> findSpan(String spanId) {
        return spans.stream()
                .filter(span -> span.getId().equals(spanId))
                .findFirst();
    }

    /**
     * @return Spans with the given name, in creation order
     */
    public List<Span> spansNamed(String name) {
        return spans.stream()
                .filter(span -> span.getName().equals(name))
                .toList();
    }

    void addSpan(Span span) {
        spans.add(span);
    }

    void end(long endTime, Map<String, Object> attributes) {
        if (null != attributes) {
            this.attributes.putAll(attributes);
        }
        this.endTime = endTime;
    }
}
