package io.formresolve.core.error;

/** Thrown when a request names a schema id (or {@code id@version}) that is not loaded. */
public final class SchemaNotFoundException extends FormEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:form-resolve:error:schema-not-found";

    public SchemaNotFoundException(String schemaId) {
        super("No schema loaded for '" + schemaId + "'", schemaId);
    }
}
