package io.formresolve.standalone.server;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.formresolve.core.engine.FormEngine;
import io.formresolve.core.engine.ValidationProblemBuilder;
import io.formresolve.core.model.CompileResult;
import io.formresolve.core.model.FormSchema;
import io.formresolve.core.model.RuntimeValues;
import io.javalin.http.Context;

/**
 * {@code POST /forms/{schemaId}/compile}: compiles the posted values. A valid result answers
 * {@code 200 {"schemaId", "actionId", "payload"}}; a rejected one answers an RFC 9457 problem with
 * the configured status.
 */
final class CompileHandler extends FormRequestHandler {

    private final ValidationProblemBuilder problemBuilder;

    CompileHandler(FormEngine engine, ValidationProblemBuilder problemBuilder) {
        super(engine);
        this.problemBuilder = problemBuilder;
    }

    @Override
    void handle(Context ctx, FormSchema schema, RuntimeValues values) {
        CompileResult result = engine.compile(schema, values);
        if (!result.isValid()) {
            respond(ctx, problemBuilder.status(), "application/problem+json", problemBuilder.build(result, ctx.path()));
            return;
        }

        ObjectNode body = MAPPER.createObjectNode();
        body.put("schemaId", result.schemaId());
        body.put("actionId", result.actionId());
        body.set("payload", result.payload());
        respond(ctx, 200, "application/json", body);
    }
}
