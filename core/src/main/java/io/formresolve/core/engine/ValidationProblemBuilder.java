package io.formresolve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.formresolve.core.error.UnknownOperationException;
import io.formresolve.core.model.CompileResult;
import io.formresolve.core.model.Violation;

/**
 * Renders rejected compilation results as RFC 9457 Problem Details.
 *
 * <p>
 * INVALID results carry a {@code violations} array with one {@code {code, param, message}} object
 * per violation, in detection order. UNKNOWN_OPERATION results carry the rejected {@code value}.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class ValidationProblemBuilder {

    /** Problem type of an INVALID result. */
    public static final String VALIDATION_URN = "urn:form-resolve:error:validation-failed";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_STATUS = 422;

    private final int status;

    /** Creates a builder with HTTP status 422. */
    public ValidationProblemBuilder() {
        this(DEFAULT_STATUS);
    }

    /**
     * Creates a builder with a custom HTTP status code.
     *
     * @param status the HTTP status code to use in problem responses
     */
    public ValidationProblemBuilder(int status) {
        this.status = status;
    }

    /** Returns the HTTP status code used by this builder. */
    public int status() {
        return status;
    }

    /**
     * Builds the problem document of a rejected result.
     *
     * @param result       an INVALID or UNKNOWN_OPERATION result
     * @param instancePath the request path, may be null
     * @return the problem document
     * @throws IllegalArgumentException if the result is VALID
     */
    public JsonNode build(CompileResult result, String instancePath) {
        if (result.isValid()) {
            throw new IllegalArgumentException("a VALID result has no problem to report");
        }
        ObjectNode problem = MAPPER.createObjectNode();
        if (result.isInvalid()) {
            problem.put("type", VALIDATION_URN);
            problem.put("title", "Validation Failed");
        } else {
            problem.put("type", UnknownOperationException.URN);
            problem.put("title", "Unknown Operation");
        }
        problem.put("status", status);
        problem.put("detail", result.detail());
        if (instancePath != null) {
            problem.put("instance", instancePath);
        } else {
            problem.putNull("instance");
        }
        problem.put("schemaId", result.schemaId());

        if (result.isInvalid()) {
            problem.put("actionId", result.actionId());
            ArrayNode violations = problem.putArray("violations");
            for (Violation violation : result.validationError().violations()) {
                ObjectNode entry = violations.addObject();
                entry.put("code", violation.code().name());
                entry.put("param", violation.param());
                entry.put("message", violation.message());
            }
        } else {
            problem.put("value", result.unknownValue());
        }
        return problem;
    }
}
