package io.formresolve.core.spi;

/**
 * SPI for observability hooks.
 *
 * <p>
 * Adapters bridge these events to whatever metrics or tracing system they use; the core has no
 * telemetry dependency. Implementations MUST be thread-safe and non-blocking. Exceptions thrown by
 * listeners are caught by the engine and logged; they do NOT affect loading or compilation.
 */
public interface TelemetryListener {

    /**
     * Called when a schema is successfully loaded (or reloaded).
     *
     * @param event contains schemaId, version, source
     */
    void onSchemaLoaded(SchemaLoadedEvent event);

    /**
     * Called when a schema is rejected at load time.
     *
     * @param event contains source, errorDetail
     */
    void onSchemaRejected(SchemaRejectedEvent event);

    /** Called when a compilation produced a payload. */
    void onCompilationCompleted(CompilationCompletedEvent event);

    /** Called when a compilation was rejected (validation errors or unknown operation). */
    void onCompilationRejected(CompilationRejectedEvent event);

    // --- Event records ---

    /** Event emitted when a schema is loaded. */
    record SchemaLoadedEvent(String schemaId, String version, String source) {}

    /** Event emitted when a schema is rejected. */
    record SchemaRejectedEvent(String source, String errorDetail) {}

    /** Event emitted when a compilation succeeds. */
    record CompilationCompletedEvent(String schemaId, String actionId, int payloadKeys, long durationMs) {}

    /** Event emitted when a compilation is rejected. */
    record CompilationRejectedEvent(
            String schemaId, String actionId, String outcome, int violationCount, long durationMs) {}
}
