package io.formresolve.core.error;

/**
 * Abstract base for all form-resolve exceptions. Never thrown directly; use the concrete subclasses
 * under {@link SchemaLoadException} or {@link FormEvalException}.
 */
public abstract class FormException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EVALUATION
    }

    private final String schemaId;
    private final Phase phase;

    protected FormException(String message, String schemaId, Phase phase) {
        super(message);
        this.schemaId = schemaId;
        this.phase = phase;
    }

    protected FormException(String message, Throwable cause, String schemaId, Phase phase) {
        super(message, cause);
        this.schemaId = schemaId;
        this.phase = phase;
    }

    /** The schema that triggered the error, or {@code null} if not yet identified. */
    public String schemaId() {
        return schemaId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
