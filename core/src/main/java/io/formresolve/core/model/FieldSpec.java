package io.formresolve.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Schema description of one configurable input. Immutable, created at load time by {@code
 * SchemaParser}.
 *
 * @param id               unique field id within the schema
 * @param canonicalParamId logical parameter this field supplies; defaults to {@code id}
 * @param mode             UI modality, decides precedence inside a canonical group
 * @param condition        visibility predicate, or {@code null} for always visible
 * @param dependsOn        fields whose effective values must be non-empty before this one is ready
 * @param required         whether the canonical value must be non-empty while this field is active
 * @param valueKind        declared value type
 */
public record FieldSpec(
        String id,
        String canonicalParamId,
        FieldMode mode,
        Condition condition,
        List<String> dependsOn,
        boolean required,
        ValueKind valueKind) {

    public FieldSpec {
        Objects.requireNonNull(id, "id must not be null");
        canonicalParamId = canonicalParamId != null ? canonicalParamId : id;
        mode = mode != null ? mode : FieldMode.BASIC;
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        valueKind = valueKind != null ? valueKind : ValueKind.STRING;
    }

    /** A basic, optional, unconditional string field. */
    public static FieldSpec of(String id) {
        return new FieldSpec(id, null, null, null, null, false, null);
    }

    /** Returns {@code true} if this field is gated by a visibility condition. */
    public boolean isConditional() {
        return condition != null;
    }
}
