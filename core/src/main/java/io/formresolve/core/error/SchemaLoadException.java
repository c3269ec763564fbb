package io.formresolve.core.error;

/**
 * Abstract parent for load-time schema errors. Thrown by {@code FormEngine.loadSchema()} and
 * {@code FormEngine.reload()}; always fatal for the schema being loaded. Carries an additional
 * {@code source} field identifying the file or resource that caused the error.
 */
public abstract class SchemaLoadException extends FormException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected SchemaLoadException(String message, String schemaId, String source) {
        super(message, schemaId, Phase.LOAD);
        this.source = source;
    }

    protected SchemaLoadException(String message, Throwable cause, String schemaId, String source) {
        super(message, cause, schemaId, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
