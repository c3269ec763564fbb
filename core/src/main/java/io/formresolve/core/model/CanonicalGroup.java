package io.formresolve.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The fields that supply one canonical parameter, in precedence order (first wins).
 *
 * @param canonicalParamId the logical parameter id
 * @param fieldIds         member field ids, highest precedence first
 */
public record CanonicalGroup(String canonicalParamId, List<String> fieldIds) {

    public CanonicalGroup {
        Objects.requireNonNull(canonicalParamId, "canonicalParamId must not be null");
        fieldIds = List.copyOf(fieldIds);
        if (fieldIds.isEmpty()) {
            throw new IllegalArgumentException("canonical group '" + canonicalParamId + "' has no fields");
        }
    }

    public boolean contains(String fieldId) {
        return fieldIds.contains(fieldId);
    }
}
