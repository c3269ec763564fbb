package io.formresolve.core.model;

/** What {@code OperationSelector} does with a discriminator value that has no mapping. */
public enum UnknownValuePolicy {
    /** Reject the compilation with an unknown-operation error. */
    STRICT_THROW("strict-throw"),
    /** Use the operation rule's default action. */
    FALLBACK_DEFAULT("fallback-default");

    private final String schemaName;

    UnknownValuePolicy(String schemaName) {
        this.schemaName = schemaName;
    }

    /** The spelling used in schema documents and configuration. */
    public String schemaName() {
        return schemaName;
    }

    /**
     * Parses the schema spelling ({@code strict-throw} / {@code fallback-default}).
     *
     * @throws IllegalArgumentException for any other value
     */
    public static UnknownValuePolicy fromSchema(String value) {
        String trimmed = value.trim();
        for (UnknownValuePolicy policy : values()) {
            if (policy.schemaName.equalsIgnoreCase(trimmed)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown value policy '" + value + "', expected strict-throw or fallback-default");
    }
}
