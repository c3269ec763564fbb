package io.formresolve.core.engine;

import io.formresolve.core.error.SchemaNotFoundException;
import io.formresolve.core.error.UnknownOperationException;
import io.formresolve.core.model.CompileResult;
import io.formresolve.core.model.FormSchema;
import io.formresolve.core.model.ResolvedForm;
import io.formresolve.core.model.RuntimeValues;
import io.formresolve.core.spec.SchemaParser;
import io.formresolve.core.spi.TelemetryListener;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Form resolution and parameter compilation engine. Loads form schemas from YAML and answers
 * per-request questions about them: which fields are visible, ready and active, and which action
 * payload the current values compile to.
 *
 * <p>
 * Thread-safe: the engine holds an immutable {@link FormRegistry} snapshot in an
 * {@link AtomicReference}. {@link #reload} swaps the whole registry at once, so a request that
 * captured the old snapshot completes with it while new requests see the new one. Evaluation
 * never mutates the schema or the caller's values.
 *
 * <p>
 * Runtime values are never logged; they may carry credentials.
 */
public final class FormEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FormEngine.class);

    private final SchemaParser schemaParser;
    private final FormResolver formResolver;
    private final OperationSelector operationSelector;
    private final ParameterCompiler parameterCompiler;
    private final TelemetryListener telemetryListener;
    private final AtomicReference<FormRegistry> registryRef = new AtomicReference<>(FormRegistry.empty());

    /** Creates an engine with a default parser ({@code strict-throw} default policy). */
    public FormEngine() {
        this(new SchemaParser(), null);
    }

    public FormEngine(SchemaParser schemaParser) {
        this(schemaParser, null);
    }

    /**
     * Creates an engine with an optional telemetry listener.
     *
     * @param schemaParser      parser used to load schema documents
     * @param telemetryListener listener for load and compile events, may be null
     */
    public FormEngine(SchemaParser schemaParser, TelemetryListener telemetryListener) {
        this.schemaParser = Objects.requireNonNull(schemaParser, "schemaParser must not be null");
        this.formResolver = new FormResolver();
        this.operationSelector = new OperationSelector();
        this.parameterCompiler = new ParameterCompiler();
        this.telemetryListener = telemetryListener; // nullable
    }

    // --- Loading ---

    /**
     * Loads a schema file and registers it by id and by {@code id@version}. A schema with the same
     * key is replaced.
     *
     * @param path path to the schema YAML file
     * @return the loaded schema
     * @throws io.formresolve.core.error.SchemaLoadException if the schema is rejected
     */
    public FormSchema loadSchema(Path path) {
        try {
            return register(schemaParser.parse(path), path.toString());
        } catch (RuntimeException e) {
            notifySchemaRejected(path.toString(), e);
            throw e;
        }
    }

    /**
     * Loads a schema from YAML text.
     *
     * @param yaml   the schema document
     * @param source label used in error messages and telemetry (e.g. a resource name)
     * @return the loaded schema
     * @throws io.formresolve.core.error.SchemaLoadException if the schema is rejected
     */
    public FormSchema loadSchema(String yaml, String source) {
        try {
            return register(schemaParser.parse(yaml, source), source);
        } catch (RuntimeException e) {
            notifySchemaRejected(source, e);
            throw e;
        }
    }

    private FormSchema register(FormSchema schema, String source) {
        registryRef.updateAndGet(old -> {
            Map<String, FormSchema> updated = new HashMap<>(old.allSchemas());
            updated.put(schema.id(), schema);
            updated.put(schema.versionedId(), schema);
            return new FormRegistry(updated);
        });
        LOG.info("Loaded schema: id={}, version={}, fields={}", schema.id(), schema.version(), schema.fields().size());
        notifySchemaLoaded(schema, source);
        return schema;
    }

    /**
     * Replaces every loaded schema with the given files. The new registry is built completely
     * before it is swapped in; if any file is rejected, the current registry stays in place.
     *
     * @param schemaPaths schema YAML files
     * @throws io.formresolve.core.error.SchemaLoadException if any schema is rejected
     */
    public void reload(List<Path> schemaPaths) {
        FormRegistry.Builder builder = FormRegistry.builder();
        for (Path schemaPath : schemaPaths) {
            FormSchema schema;
            try {
                schema = schemaParser.parse(schemaPath);
            } catch (RuntimeException e) {
                notifySchemaRejected(schemaPath.toString(), e);
                throw e;
            }
            builder.addSchema(schema);
            notifySchemaLoaded(schema, schemaPath.toString());
        }
        FormRegistry newRegistry = builder.build();
        registryRef.set(newRegistry);
        LOG.info("Registry reloaded: schemas={}", newRegistry.distinctSchemas().size());
    }

    /** The current registry snapshot. */
    public FormRegistry registry() {
        return registryRef.get();
    }

    /** Looks up a schema by id or {@code id@version}. */
    public Optional<FormSchema> schema(String schemaId) {
        return Optional.ofNullable(registryRef.get().getSchema(schemaId));
    }

    /**
     * Looks up a schema by id or {@code id@version}.
     *
     * @throws SchemaNotFoundException if none is loaded
     */
    public FormSchema requireSchema(String schemaId) {
        return schema(schemaId).orElseThrow(() -> new SchemaNotFoundException(schemaId));
    }

    // --- Resolution ---

    /** Resolves visibility, readiness and canonical values of a loaded schema. */
    public ResolvedForm resolve(String schemaId, RuntimeValues values) {
        return resolve(requireSchema(schemaId), values);
    }

    public ResolvedForm resolve(FormSchema schema, RuntimeValues values) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(values, "values must not be null");
        return formResolver.resolve(schema, values);
    }

    /** Fields whose visibility condition holds, in schema field order. */
    public Set<String> visibleFields(String schemaId, RuntimeValues values) {
        return resolve(schemaId, values).visible();
    }

    public Set<String> visibleFields(FormSchema schema, RuntimeValues values) {
        return resolve(schema, values).visible();
    }

    /**
     * Returns {@code true} if every dependency of the field has a non-empty effective value.
     *
     * @throws IllegalArgumentException if the schema declares no such field
     */
    public boolean isReady(String schemaId, String fieldId, RuntimeValues values) {
        FormSchema schema = requireSchema(schemaId);
        schema.requireField(fieldId);
        return resolve(schema, values).isReady(fieldId);
    }

    /** Fields that are both visible and ready, in schema field order. */
    public Set<String> activeFields(String schemaId, RuntimeValues values) {
        return resolve(schemaId, values).active();
    }

    public Set<String> activeFields(FormSchema schema, RuntimeValues values) {
        return resolve(schema, values).active();
    }

    // --- Compilation ---

    /**
     * Compiles raw values into the payload of the action they select.
     *
     * @throws SchemaNotFoundException if no schema is loaded under {@code schemaId}
     */
    public CompileResult compile(String schemaId, RuntimeValues values) {
        return compile(requireSchema(schemaId), values);
    }

    /**
     * Compiles raw values against a schema. Never throws for bad input: missing or invalid values
     * give an INVALID result, an unmapped discriminator under {@code strict-throw} gives
     * UNKNOWN_OPERATION.
     */
    public CompileResult compile(FormSchema schema, RuntimeValues values) {
        long startNanos = System.nanoTime();
        ResolvedForm form = resolve(schema, values);
        CompileResult result;
        try {
            String actionId = selectAction(schema, form);
            result = parameterCompiler.compile(schema, actionId, form);
        } catch (UnknownOperationException e) {
            result = CompileResult.unknownOperation(schema.id(), e.value());
        }
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;

        if (result.isValid()) {
            LOG.atInfo()
                    .setMessage("compile.valid")
                    .addKeyValue("schema_id", schema.id())
                    .addKeyValue("schema_version", schema.version())
                    .addKeyValue("action_id", result.actionId())
                    .addKeyValue("payload_keys", result.payload().size())
                    .addKeyValue("duration_ms", elapsedMs)
                    .log();
            notifyCompilationCompleted(result, elapsedMs);
        } else {
            int violations = result.isInvalid() ? result.validationError().size() : 0;
            LOG.atInfo()
                    .setMessage("compile.rejected")
                    .addKeyValue("schema_id", schema.id())
                    .addKeyValue("schema_version", schema.version())
                    .addKeyValue("action_id", result.actionId())
                    .addKeyValue("outcome", result.type().name())
                    .addKeyValue("violations", violations)
                    .addKeyValue("duration_ms", elapsedMs)
                    .log();
            notifyCompilationRejected(result, violations, elapsedMs);
        }
        return result;
    }

    private String selectAction(FormSchema schema, ResolvedForm form) {
        if (!schema.hasOperationRule()) {
            return schema.actions().keySet().iterator().next();
        }
        String discriminatorParam = schema.requireField(schema.operationRule().discriminatorField())
                .canonicalParamId();
        String value = form.canonicalValue(discriminatorParam)
                .map(JsonNodeUtils::scalarText)
                .orElse(null);
        return operationSelector.selectAction(value, schema.operationRule());
    }

    // --- Telemetry notification helpers ---
    // Listener exceptions are caught and logged; they never affect loading or compilation.

    private void notifySchemaLoaded(FormSchema schema, String source) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onSchemaLoaded(
                    new TelemetryListener.SchemaLoadedEvent(schema.id(), schema.version(), source));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onSchemaLoaded failed", e);
        }
    }

    private void notifySchemaRejected(String source, Exception cause) {
        LOG.warn("Schema rejected: source={}, reason={}", source, cause.getMessage());
        if (telemetryListener == null) return;
        try {
            telemetryListener.onSchemaRejected(new TelemetryListener.SchemaRejectedEvent(source, cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onSchemaRejected failed", e);
        }
    }

    private void notifyCompilationCompleted(CompileResult result, long durationMs) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onCompilationCompleted(new TelemetryListener.CompilationCompletedEvent(
                    result.schemaId(), result.actionId(), result.payload().size(), durationMs));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onCompilationCompleted failed", e);
        }
    }

    private void notifyCompilationRejected(CompileResult result, int violations, long durationMs) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onCompilationRejected(new TelemetryListener.CompilationRejectedEvent(
                    result.schemaId(), result.actionId(), result.type().name(), violations, durationMs));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onCompilationRejected failed", e);
        }
    }
}
