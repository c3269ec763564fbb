package io.formresolve.core.error;

import java.util.List;

/** Thrown when the {@code depends-on} edges of a schema do not form a DAG. */
public final class DependencyCycleException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public DependencyCycleException(String message, List<String> cycle, String schemaId, String source) {
        super(message, schemaId, source);
        this.cycle = List.copyOf(cycle);
    }

    /** The field ids on the cycle, in dependency order, first id repeated at the end. */
    public List<String> cycle() {
        return cycle;
    }
}
