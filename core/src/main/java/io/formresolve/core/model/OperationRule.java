package io.formresolve.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps the value of a discriminator field to a backend action id.
 *
 * @param discriminatorField field whose effective value selects the action
 * @param mapping            discriminator value to action id, in declaration order
 * @param defaultActionId    action used on a miss under {@link UnknownValuePolicy#FALLBACK_DEFAULT};
 *                           may be {@code null} under {@link UnknownValuePolicy#STRICT_THROW}
 * @param unknownValuePolicy what to do on a miss
 */
public record OperationRule(
        String discriminatorField,
        Map<String, String> mapping,
        String defaultActionId,
        UnknownValuePolicy unknownValuePolicy) {

    public OperationRule {
        Objects.requireNonNull(discriminatorField, "discriminatorField must not be null");
        Objects.requireNonNull(unknownValuePolicy, "unknownValuePolicy must not be null");
        mapping = mapping != null ? Collections.unmodifiableMap(new LinkedHashMap<>(mapping)) : Map.of();
    }
}
