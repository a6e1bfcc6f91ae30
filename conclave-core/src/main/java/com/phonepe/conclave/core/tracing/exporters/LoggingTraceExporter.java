/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.conclave.core.tracing.exporters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.conclave.core.tracing.Span;
import com.phonepe.conclave.core.tracing.SpanStatus;
import com.phonepe.conclave.core.tracing.Trace;
import com.phonepe.conclave.core.tracing.TraceExporter;
import com.phonepe.conclave.core.utils.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Logs finished traces as an indented span tree
 */
@Slf4j
public class LoggingTraceExporter implements TraceExporter {
    private static final int INDENT = 2;

    private final ObjectMapper mapper = JsonUtils.createMapper();

    @Override
    public void export(Trace trace) {
        if (log.isInfoEnabled()) {
            log.info("\n{}", render(trace));
        }
    }

    public String render(Trace trace) {
        final var out = new StringBuilder();
        out.append("Trace: ")
                .append(trace.getName())
                .append(" (")
                .append(duration(trace.getStartTime(), trace.getEndTime()))
                .append(')');
        appendAttributes(out, trace.getAttributes());
        out.append('\n');

        final var spans = trace.getSpans();
        final var children = new LinkedHashMap<String, List<Span>>();
        final var roots = new ArrayList<Span>();
        for (final var span : spans) {
            if (null == span.getParentId() || trace.findSpan(span.getParentId()).isEmpty()) {
                roots.add(span);
            }
            else {
                children.computeIfAbsent(span.getParentId(), id -> new ArrayList<>()).add(span);
            }
        }
        roots.forEach(root -> renderSpan(out, root, children, 1));
        return out.toString();
    }

    private void renderSpan(StringBuilder out, Span span, Map<String, List<Span>> children, int depth) {
        out.append(Strings.repeat(" ", depth * INDENT))
                .append(mark(span))
                .append(' ')
                .append(span.getName())
                .append(" (")
                .append(duration(span.getStartTime(), span.getEndTime()))
                .append(')');
        appendAttributes(out, span.getAttributes());
        out.append('\n');
        for (final var event : span.getEvents()) {
            out.append(Strings.repeat(" ", (depth + 1) * INDENT))
                    .append("* ")
                    .append(event.getName());
            appendAttributes(out, event.getAttributes());
            out.append('\n');
        }
        children.getOrDefault(span.getId(), List.of())
                .forEach(child -> renderSpan(out, child, children, depth + 1));
    }

    private void appendAttributes(StringBuilder out, Map<String, Object> attributes) {
        if (null == attributes || attributes.isEmpty()) {
            return;
        }
        final Map<String, Object> copy;
        synchronized (attributes) {
            copy = new LinkedHashMap<>(attributes);
        }
        try {
            out.append(' ').append(mapper.writeValueAsString(copy));
        }
        catch (JsonProcessingException e) {
            log.warn("Could not render attributes: {}", e.getMessage());
            out.append(' ').append(copy);
        }
    }

    private static String mark(Span span) {
        if (span.isOpen()) {
            return "[open]";
        }
        return span.getStatus() == SpanStatus.ERROR ? "[error]" : "[ok]";
    }

    static String duration(long start, Long end) {
        if (null == end) {
            return "running";
        }
        final var millis = end - start;
        if (millis < 1000) {
            return millis + "ms";
        }
        return String.format(Locale.ROOT, "%.2fs", millis / 1000.0);
    }
}
