package org.structura.runtime.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.structura.runtime.api.SchemaException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link ExecutionPlan} documents from JSON.
 * <p>
 * The reader only maps the document onto the plan types; an unknown operation kind or variant
 * fails here, every other shape problem is left to {@link PlanSchemaValidator}.
 */
public class PlanReader {

    private static final Logger LOG = LoggerFactory.getLogger(PlanReader.class);

    private final ObjectMapper mapper;

    public PlanReader() {
        this(new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES));
    }

    /**
     * @param mapper The Jackson mapper to read with.
     */
    public PlanReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Reads a plan file.
     *
     * @param file Path of the JSON document.
     * @return The plan.
     * @throws SchemaException if the file cannot be read or is not a plan document.
     */
    public ExecutionPlan read(Path file) throws SchemaException {
        LOG.debug("Reading plan from {}", file.toAbsolutePath());
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.getFileName().toString());
        } catch (IOException e) {
            throw new SchemaException("Cannot read plan file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a plan from a stream. The stream is not closed.
     *
     * @param in The JSON document.
     * @param sourceName Name used in error messages.
     * @return The plan.
     * @throws SchemaException if the document is not a plan.
     */
    public ExecutionPlan read(InputStream in, String sourceName) throws SchemaException {
        try {
            return requireContent(mapper.readValue(in, ExecutionPlan.class), sourceName);
        } catch (JsonProcessingException e) {
            throw new SchemaException("Malformed plan document " + sourceName + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SchemaException("Cannot read plan document " + sourceName + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a plan from a JSON string.
     *
     * @param json The JSON document.
     * @return The plan.
     * @throws SchemaException if the document is not a plan.
     */
    public ExecutionPlan readString(String json) throws SchemaException {
        try {
            return requireContent(mapper.readValue(json, ExecutionPlan.class), "<string>");
        } catch (JsonProcessingException e) {
            throw new SchemaException("Malformed plan document: " + e.getOriginalMessage(), e);
        }
    }

    private static ExecutionPlan requireContent(ExecutionPlan plan, String sourceName) throws SchemaException {
        if (plan == null) {
            throw new SchemaException("Plan document " + sourceName + " is empty");
        }
        return plan;
    }
}
