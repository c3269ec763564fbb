package io.formresolve.core.error;

/**
 * Thrown when a discriminator value has no mapping and the operation rule's policy is {@code
 * strict-throw}. URN: {@code urn:form-resolve:error:unknown-operation}
 */
public final class UnknownOperationException extends FormEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:form-resolve:error:unknown-operation";

    private final String value;

    public UnknownOperationException(String value, String schemaId) {
        super("Unknown operation: " + (value != null ? "'" + value + "'" : "<missing>"), schemaId);
        this.value = value;
    }

    /** The rejected discriminator value, or {@code null} if none was supplied. */
    public String value() {
        return value;
    }
}
