package io.formresolve.core.error;

/**
 * Abstract parent for per-request errors. {@link UnknownOperationException} is caught by {@code
 * FormEngine.compile()} and turned into a rejected {@code CompileResult}; {@link
 * SchemaNotFoundException} is thrown by schema lookups before any evaluation starts.
 */
public abstract class FormEvalException extends FormException {

    private static final long serialVersionUID = 1L;

    protected FormEvalException(String message, String schemaId) {
        super(message, schemaId, Phase.EVALUATION);
    }

    protected FormEvalException(String message, Throwable cause, String schemaId) {
        super(message, cause, schemaId, Phase.EVALUATION);
    }
}
