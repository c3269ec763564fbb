package io.formresolve.standalone.server;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.formresolve.core.engine.FormEngine;
import io.formresolve.core.model.FormSchema;
import io.formresolve.core.model.ResolvedForm;
import io.formresolve.core.model.RuntimeValues;
import io.javalin.http.Context;

/**
 * {@code POST /forms/{schemaId}/fields}: answers which fields are visible, ready and active for the
 * posted values.
 *
 * <pre>
 * {"schemaId": "mail", "visible": [...], "ready": [...], "active": [...]}
 * </pre>
 */
final class FieldStateHandler extends FormRequestHandler {

    FieldStateHandler(FormEngine engine) {
        super(engine);
    }

    @Override
    void handle(Context ctx, FormSchema schema, RuntimeValues values) {
        ResolvedForm form = engine.resolve(schema, values);

        ObjectNode body = MAPPER.createObjectNode();
        body.put("schemaId", schema.id());
        form.visible().forEach(body.putArray("visible")::add);
        form.ready().forEach(body.putArray("ready")::add);
        form.active().forEach(body.putArray("active")::add);
        respond(ctx, 200, "application/json", body);
    }
}
