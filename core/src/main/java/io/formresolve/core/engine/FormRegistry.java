package io.formresolve.core.engine;

import io.formresolve.core.model.FormSchema;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable snapshot of all loaded schemas.
 *
 * <p>
 * This is the unit of atomic swap in {@link FormEngine#reload}. The engine holds a
 * {@code FormRegistry} reference via {@link java.util.concurrent.atomic.AtomicReference};
 * {@code reload()} builds a new registry and swaps it in. Requests that captured the old
 * reference finish with it; new requests pick up the new one.
 *
 * <p>
 * Each schema is registered under its id and under {@code id@version}. Thread-safe: all fields
 * are final and collections are unmodifiable.
 */
public final class FormRegistry {

    private final Map<String, FormSchema> schemas;

    /**
     * Creates a registry. The map is copied; later changes by the caller are not seen.
     *
     * @param schemas map of schema keys (by id and by id@version) to schemas
     */
    public FormRegistry(Map<String, FormSchema> schemas) {
        this.schemas = Collections.unmodifiableMap(new HashMap<>(schemas));
    }

    /** Returns an empty registry. */
    public static FormRegistry empty() {
        return new FormRegistry(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a schema by its id or by its {@code id@version} key.
     *
     * @return the schema, or null if not found
     */
    public FormSchema getSchema(String key) {
        return schemas.get(key);
    }

    /** Unmodifiable view of all entries (keyed by id and by id@version). */
    public Map<String, FormSchema> allSchemas() {
        return schemas;
    }

    /** Distinct loaded schemas, sorted by {@code id@version}. */
    public Collection<FormSchema> distinctSchemas() {
        Map<String, FormSchema> distinct = new TreeMap<>();
        schemas.values().forEach(schema -> distinct.putIfAbsent(schema.versionedId(), schema));
        return Collections.unmodifiableCollection(distinct.values());
    }

    /** Number of map entries (both by-id and by-id@version keys). */
    public int schemaCount() {
        return schemas.size();
    }

    public boolean isEmpty() {
        return schemas.isEmpty();
    }

    /** Builds a {@link FormRegistry} one schema at a time. */
    public static final class Builder {

        private final Map<String, FormSchema> schemas = new HashMap<>();

        Builder() {}

        /** Registers a schema under both its id and its {@code id@version} key. */
        public Builder addSchema(FormSchema schema) {
            schemas.put(schema.id(), schema);
            schemas.put(schema.versionedId(), schema);
            return this;
        }

        public FormRegistry build() {
            return new FormRegistry(schemas);
        }
    }
}
