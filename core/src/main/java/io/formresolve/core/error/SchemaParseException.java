package io.formresolve.core.error;

/** Thrown when a schema document has invalid YAML syntax or violates the document structure. */
public final class SchemaParseException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaParseException(String message, String schemaId, String source) {
        super(message, schemaId, source);
    }

    public SchemaParseException(String message, Throwable cause, String schemaId, String source) {
        super(message, cause, schemaId, source);
    }
}
