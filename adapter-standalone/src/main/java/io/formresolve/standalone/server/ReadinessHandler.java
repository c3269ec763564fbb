package io.formresolve.standalone.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.formresolve.core.engine.FormEngine;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Readiness probe. Returns {@code 200 {"status":"READY","schemas":N}} once at least one schema is
 * loaded, {@code 503 {"status":"NOT_READY"}} otherwise.
 */
public final class ReadinessHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ReadinessHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String NOT_READY_RESPONSE = "{\"status\":\"NOT_READY\"}";

    private final FormEngine engine;

    public ReadinessHandler(FormEngine engine) {
        this.engine = engine;
    }

    @Override
    public void handle(Context ctx) {
        ctx.contentType("application/json");

        int schemas = engine.registry().distinctSchemas().size();
        if (schemas == 0) {
            LOG.debug("Readiness check: no schemas loaded");
            ctx.status(503);
            ctx.result(NOT_READY_RESPONSE);
            return;
        }

        ObjectNode body = MAPPER.createObjectNode();
        body.put("status", "READY");
        body.put("schemas", schemas);
        ctx.status(200);
        ctx.result(body.toString());
    }
}
