package com.phonepe.conclave.core.tracing.exporters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.conclave.core.errors.ConclaveException;
import com.phonepe.conclave.core.errors.ErrorType;
import com.phonepe.conclave.core.tracing.Trace;
import com.phonepe.conclave.core.tracing.TraceExporter;
import com.phonepe.conclave.core.utils.JsonUtils;
import lombok.Builder;
import lombok.NonNull;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Serializes finished traces to JSON and hands the text over to a sink
 */
public class JsonTraceExporter implements TraceExporter {
    private final ObjectMapper mapper;
    private final Consumer<String> sink;
    private final boolean pretty;

    @Builder
    public JsonTraceExporter(ObjectMapper mapper, @NonNull Consumer<String> sink, boolean pretty) {
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.sink = sink;
        this.pretty = pretty;
    }

    @Override
    public void export(Trace trace) {
        sink.accept(serialize(trace));
    }

    public String serialize(Trace trace) {
        try {
            return pretty
                   ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(trace)
                   : mapper.writeValueAsString(trace);
        }
        catch (JsonProcessingException e) {
            throw new ConclaveException(ErrorType.SERIALIZATION_ERROR, e, e.getMessage());
        }
    }
}
