package io.formresolve.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Loaded and validated form schema for one block type. Immutable, thread-safe; created at load
 * time by {@code SchemaParser} and shared across concurrent requests.
 *
 * <p>
 * {@code fieldOrder} is the dependency order computed at load time: every field appears after all
 * members of the canonical groups it depends on. Request-time resolution walks fields in this
 * order.
 *
 * @param id              block type id
 * @param version         schema version
 * @param description     optional description
 * @param fields          field id to field spec, in declaration order
 * @param canonicalGroups canonical id to its group, in first-declaration order
 * @param fieldOrder      field ids in dependency order
 * @param operationRule   discriminator rule, or {@code null} for single-action schemas
 * @param actions         action id to its requirement rule, in declaration order
 */
public record FormSchema(
        String id,
        String version,
        String description,
        Map<String, FieldSpec> fields,
        Map<String, CanonicalGroup> canonicalGroups,
        List<String> fieldOrder,
        OperationRule operationRule,
        Map<String, RequirementRule> actions) {

    public FormSchema {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(version, "version must not be null");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        canonicalGroups = Collections.unmodifiableMap(new LinkedHashMap<>(canonicalGroups));
        fieldOrder = List.copyOf(fieldOrder);
        actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    }

    /** Returns the field with the given id, if declared. */
    public Optional<FieldSpec> field(String fieldId) {
        return Optional.ofNullable(fields.get(fieldId));
    }

    /**
     * Returns the field with the given id.
     *
     * @throws IllegalArgumentException if no such field is declared
     */
    public FieldSpec requireField(String fieldId) {
        return field(fieldId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Schema '" + id + "' declares no field '" + fieldId + "'"));
    }

    /** Returns the canonical group the given field belongs to. */
    public CanonicalGroup groupOf(String fieldId) {
        return canonicalGroups.get(requireField(fieldId).canonicalParamId());
    }

    /** Returns the value kind shared by the members of a canonical group. */
    public ValueKind kindOf(String canonicalParamId) {
        CanonicalGroup group = canonicalGroups.get(canonicalParamId);
        if (group == null) {
            throw new IllegalArgumentException(
                    "Schema '" + id + "' declares no canonical parameter '" + canonicalParamId + "'");
        }
        return requireField(group.fieldIds().get(0)).valueKind();
    }

    /** Returns the requirement rule of an action, if declared. */
    public Optional<RequirementRule> requirementRule(String actionId) {
        return Optional.ofNullable(actions.get(actionId));
    }

    /** Returns {@code true} if the schema routes through a discriminator field. */
    public boolean hasOperationRule() {
        return operationRule != null;
    }

    /** Returns {@code id@version}, the versioned registry key. */
    public String versionedId() {
        return id + "@" + version;
    }
}
