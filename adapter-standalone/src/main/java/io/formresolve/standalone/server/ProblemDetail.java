package io.formresolve.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.formresolve.core.error.SchemaNotFoundException;

/**
 * Builds RFC 9457 Problem Details for errors raised by the HTTP layer itself: malformed request
 * bodies, unknown schemas, failed reloads. Rejected compilations are rendered by the core module's
 * {@link io.formresolve.core.engine.ValidationProblemBuilder}.
 *
 * <p>
 * Thread-safe: all methods are stateless.
 */
public final class ProblemDetail {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_BAD_REQUEST = "urn:form-resolve:server:bad-request";
    static final String URN_INTERNAL_ERROR = "urn:form-resolve:server:internal-error";

    private ProblemDetail() {
        // utility class
    }

    /** Malformed JSON or a body that is not a JSON object. */
    public static JsonNode badRequest(String detail, String instancePath) {
        return build(URN_BAD_REQUEST, "Bad Request", 400, detail, instancePath);
    }

    /** The request names a schema that is not loaded. */
    public static JsonNode schemaNotFound(String detail, String instancePath) {
        return build(SchemaNotFoundException.URN, "Schema Not Found", 404, detail, instancePath);
    }

    /** Internal error of an admin operation (reload failure). */
    public static JsonNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    static JsonNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
