package io.formresolve.standalone.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.formresolve.core.engine.FormEngine;
import io.formresolve.core.error.SchemaNotFoundException;
import io.formresolve.core.model.FormSchema;
import io.formresolve.core.model.RuntimeValues;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common front half of the {@code /forms/{schemaId}/...} endpoints: looks up the schema and reads
 * the request body as runtime values. A blank body counts as an empty object. Unknown schemas
 * answer 404, malformed bodies 400, both as RFC 9457 problems.
 */
abstract class FormRequestHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(FormRequestHandler.class);

    static final ObjectMapper MAPPER = new ObjectMapper();

    final FormEngine engine;

    FormRequestHandler(FormEngine engine) {
        this.engine = engine;
    }

    @Override
    public final void handle(Context ctx) {
        String schemaId = ctx.pathParam("schemaId");
        FormSchema schema;
        try {
            schema = engine.requireSchema(schemaId);
        } catch (SchemaNotFoundException e) {
            LOG.debug("Request for unknown schema '{}'", schemaId);
            respond(ctx, 404, "application/problem+json", ProblemDetail.schemaNotFound(e.getMessage(), ctx.path()));
            return;
        }

        RuntimeValues values;
        try {
            values = readValues(ctx.body());
        } catch (JsonProcessingException e) {
            respond(
                    ctx,
                    400,
                    "application/problem+json",
                    ProblemDetail.badRequest("Request body is not valid JSON: " + e.getOriginalMessage(), ctx.path()));
            return;
        } catch (IllegalArgumentException e) {
            respond(
                    ctx,
                    400,
                    "application/problem+json",
                    ProblemDetail.badRequest("Request body must be a JSON object", ctx.path()));
            return;
        }

        handle(ctx, schema, values);
    }

    /** Answers a request whose schema and values were read successfully. */
    abstract void handle(Context ctx, FormSchema schema, RuntimeValues values);

    static void respond(Context ctx, int status, String contentType, JsonNode body) {
        ctx.status(status);
        ctx.contentType(contentType);
        ctx.result(body.toString());
    }

    private static RuntimeValues readValues(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return RuntimeValues.empty();
        }
        return RuntimeValues.fromJson(MAPPER.readTree(body));
    }
}
