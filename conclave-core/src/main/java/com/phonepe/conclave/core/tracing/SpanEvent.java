package com.phonepe.conclave.core.tracing;

import lombok.Value;

import java.util.Map;

/**
 * Something that happened at a point in time within a span
 */
@Value
public class SpanEvent {
    String name;
    long timestamp;
    Map<String, Object> attributes;
}
