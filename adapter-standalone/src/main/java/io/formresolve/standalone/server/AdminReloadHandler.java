package io.formresolve.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.formresolve.core.engine.FormEngine;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admin reload endpoint.
 *
 * <p>
 * {@code POST /admin/reload} rescans the schemas directory and calls {@link FormEngine#reload}
 * to swap the registry atomically.
 *
 * <pre>
 * 200 OK
 * {"status": "reloaded", "schemas": N}
 * </pre>
 *
 * <p>
 * On failure it answers {@code 500} with an RFC 9457 body; the previous registry stays in place.
 */
public final class AdminReloadHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(AdminReloadHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final FormEngine engine;
    private final Path schemasDir;

    public AdminReloadHandler(FormEngine engine, Path schemasDir) {
        this.engine = engine;
        this.schemasDir = schemasDir;
    }

    @Override
    public void handle(Context ctx) {
        LOG.info("Admin reload triggered via POST {}", ctx.path());

        try {
            List<Path> schemaPaths = scanSchemaFiles(schemasDir);
            engine.reload(schemaPaths);

            ObjectNode response = MAPPER.createObjectNode();
            response.put("status", "reloaded");
            response.put("schemas", schemaPaths.size());

            ctx.status(200);
            ctx.contentType("application/json");
            ctx.result(response.toString());

            LOG.info("Reload successful: schemas={}", schemaPaths.size());
        } catch (IOException | RuntimeException e) {
            LOG.error("Reload failed: {}", e.getMessage(), e);

            JsonNode problemDetail = ProblemDetail.internalError("Reload failed: " + e.getMessage(), ctx.path());

            ctx.status(500);
            ctx.contentType("application/problem+json");
            ctx.result(problemDetail.toString());
        }
    }

    /**
     * Lists the {@code *.yaml} and {@code *.yml} files of a directory, sorted for a deterministic
     * load order. A missing directory yields an empty list.
     *
     * @throws IOException if the directory cannot be read
     */
    static List<Path> scanSchemaFiles(Path dir) throws IOException {
        if (dir == null || !Files.exists(dir)) {
            return List.of();
        }

        List<Path> schemaFiles = new ArrayList<>();
        try (Stream<Path> stream = Files.list(dir)) {
            stream.filter(FileWatcher::isSchemaFile).sorted()
                    .forEach(schemaFiles::add);
        }
        return schemaFiles;
    }
}
