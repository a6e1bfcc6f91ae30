package com.phonepe.conclave.core.tracing;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A named, timed unit of work inside a trace. Spans nest through {@link #getParentId()}.
 */
@Getter
@ToString
public class Span {
    private final String id;
    private final String name;
    private final String parentId;
    private final long startTime;
    private final Map<String, Object> attributes = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<SpanEvent> events = new CopyOnWriteArrayList<>();
    private volatile Long endTime;
    private volatile SpanStatus status;

    Span(String id, String name, String parentId, long startTime, Map<String, Object> attributes) {
        this.id = id;
        this.name = name;
        this.parentId = parentId;
        this.startTime = startTime;
        if (null != attributes) {
            this.attributes.putAll(attributes);
        }
    }

    public boolean isOpen() {
        return null == endTime;
    }

    void addEvent(SpanEvent event) {
        events.add(event);
    }

    void end(long endTime, SpanStatus status, Map<String, Object> attributes) {
        if (null != attributes) {
            this.attributes.putAll(attributes);
        }
        this.status = status;
        this.endTime = endTime;
    }
}
