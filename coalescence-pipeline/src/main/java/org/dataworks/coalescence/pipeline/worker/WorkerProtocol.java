package org.dataworks.coalescence.pipeline.worker;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

import org.dataworks.coalescence.pipeline.ir.BatchOutcome;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON exchanged with worker processes: a {@link WorkerRequest} on the worker's stdin, the list of
 * {@link BatchOutcome}s on its stdout. Streams are left open for the caller to close.
 */
public final class WorkerProtocol {
    private static final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
        .configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false);

    private static final TypeReference<List<BatchOutcome>> OUTCOMES = new TypeReference<>() {};

    private WorkerProtocol() {}

    public static void writeRequest(OutputStream output, WorkerRequest request) throws IOException {
        objectMapper.writeValue(output, request);
        output.flush();
    }

    public static WorkerRequest readRequest(InputStream input) throws IOException {
        return objectMapper.readValue(input, WorkerRequest.class);
    }

    public static void writeOutcomes(OutputStream output, List<BatchOutcome> outcomes) throws IOException {
        objectMapper.writeValue(output, outcomes);
        output.flush();
    }

    public static List<BatchOutcome> readOutcomes(byte[] json) throws IOException {
        return objectMapper.readValue(json, OUTCOMES);
    }
}
