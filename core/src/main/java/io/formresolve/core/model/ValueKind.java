package io.formresolve.core.model;

import java.util.Locale;

/** Declared type of a field's value; drives coercion in the parameter compiler. */
public enum ValueKind {
    STRING,
    NUMBER,
    BOOLEAN,
    JSON,
    ARRAY;

    /** The lower-case spelling used in schema documents. */
    public String schemaName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the schema spelling ({@code string}, {@code number}, ...).
     *
     * @throws IllegalArgumentException if the value names no kind
     */
    public static ValueKind fromSchema(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
