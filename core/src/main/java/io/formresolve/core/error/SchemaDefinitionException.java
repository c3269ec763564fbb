package io.formresolve.core.error;

/**
 * Thrown when a structurally valid schema is semantically broken: a condition or dependency names
 * an unknown field, a canonical group has no total precedence order, an action references an
 * undeclared parameter, and so on.
 */
public final class SchemaDefinitionException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaDefinitionException(String message, String schemaId, String source) {
        super(message, schemaId, source);
    }

    public SchemaDefinitionException(String message, Throwable cause, String schemaId, String source) {
        super(message, cause, schemaId, source);
    }
}
