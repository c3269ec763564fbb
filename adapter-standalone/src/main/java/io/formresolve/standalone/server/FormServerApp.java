package io.formresolve.standalone.server;

import io.formresolve.core.engine.FormEngine;
import io.formresolve.core.engine.ValidationProblemBuilder;
import io.formresolve.core.spec.SchemaParser;
import io.formresolve.standalone.config.ConfigLoader;
import io.formresolve.standalone.config.ServerConfig;
import io.javalin.Javalin;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the standalone form service.
 *
 * <ol>
 * <li>Load configuration from YAML + env overlay and configure Logback</li>
 * <li>Load every schema in {@code engine.schemas-dir}; any rejected schema aborts startup</li>
 * <li>Start Javalin with the form, probe and admin routes</li>
 * <li>Start the file watcher (if enabled)</li>
 * </ol>
 *
 * <p>
 * Kept apart from {@link io.formresolve.standalone.StandaloneMain} so tests can start and stop
 * instances directly.
 */
public final class FormServerApp {

    private static final Logger LOG = LoggerFactory.getLogger(FormServerApp.class);

    private final Javalin app;
    private final FormEngine engine;
    private final FileWatcher fileWatcher;
    private final ServerConfig config;

    private FormServerApp(Javalin app, FormEngine engine, FileWatcher fileWatcher, ServerConfig config) {
        this.app = app;
        this.engine = engine;
        this.fileWatcher = fileWatcher;
        this.config = config;
    }

    /**
     * Loads the configuration named by {@code args}, configures logging and starts the server.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/form-resolve.yaml})
     * @throws IOException if the schemas directory cannot be read or watched
     */
    public static FormServerApp start(String[] args) throws IOException {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ServerConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        return start(config);
    }

    /**
     * Starts the server from an already loaded configuration.
     *
     * @throws IOException if the schemas directory cannot be read or watched
     * @throws io.formresolve.core.error.SchemaLoadException if a schema is rejected
     */
    public static FormServerApp start(ServerConfig config) throws IOException {
        long startTime = System.nanoTime();

        FormEngine engine = new FormEngine(new SchemaParser(config.defaultUnknownValuePolicy()));
        Path schemasDir = Path.of(config.schemasDir());
        List<Path> schemaPaths = AdminReloadHandler.scanSchemaFiles(schemasDir);
        engine.reload(schemaPaths);

        ValidationProblemBuilder problemBuilder = new ValidationProblemBuilder(config.problemStatus());
        Javalin app = Javalin.create();
        app.post("/forms/{schemaId}/fields", new FieldStateHandler(engine));
        app.post("/forms/{schemaId}/compile", new CompileHandler(engine, problemBuilder));
        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
            app.get(config.readyPath(), new ReadinessHandler(engine));
        }
        app.post(config.adminReloadPath(), new AdminReloadHandler(engine, schemasDir));

        app.start(config.serverHost(), config.serverPort());

        FileWatcher fileWatcher = null;
        if (config.reloadEnabled() && Files.isDirectory(schemasDir)) {
            fileWatcher = new FileWatcher(schemasDir, config.reloadDebounceMs(), () -> {
                try {
                    List<Path> paths = AdminReloadHandler.scanSchemaFiles(schemasDir);
                    engine.reload(paths);
                    LOG.info("Hot reload complete: {} schemas", paths.size());
                } catch (IOException | RuntimeException e) {
                    LOG.error("Hot reload failed, keeping previous schemas: {}", e.getMessage(), e);
                }
            });
            try {
                fileWatcher.start();
            } catch (IOException e) {
                app.stop();
                throw e;
            }
        }

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "form-resolve started: port={}, schemas={}, policy={}, reload={}, startupMs={}",
                app.port(),
                schemaPaths.size(),
                config.defaultUnknownValuePolicy().schemaName(),
                fileWatcher != null,
                elapsedMs);

        return new FormServerApp(app, engine, fileWatcher, config);
    }

    /** The port the server listens on. */
    public int port() {
        return app.port();
    }

    public FormEngine engine() {
        return engine;
    }

    public ServerConfig config() {
        return config;
    }

    /** Stops the file watcher and the HTTP server. */
    public void stop() {
        if (fileWatcher != null) {
            fileWatcher.stop();
        }
        app.stop();
        LOG.info("form-resolve stopped");
    }
}
