package io.formresolve.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * What one backend action needs from the form. Immutable.
 *
 * @param actionId   the action this rule belongs to
 * @param params     canonical ids the payload may carry, in declaration order
 * @param required   canonical ids that must be non-empty
 * @param composites cross-field rules
 * @param defaults   canonical id to the value used when the resolved value is empty
 */
public record RequirementRule(
        String actionId,
        List<String> params,
        List<String> required,
        List<CompositeRule> composites,
        Map<String, JsonNode> defaults) {

    public RequirementRule {
        Objects.requireNonNull(actionId, "actionId must not be null");
        params = params != null ? List.copyOf(params) : List.of();
        required = required != null ? List.copyOf(required) : List.of();
        composites = composites != null ? List.copyOf(composites) : List.of();
        defaults = defaults != null ? Collections.unmodifiableMap(new LinkedHashMap<>(defaults)) : Map.of();
    }

    /**
     * The keys a payload for this action may contain: {@code params}, then required ids, composite
     * members and defaulted ids not already listed.
     */
    public List<String> payloadKeys() {
        Set<String> keys = new LinkedHashSet<>(params);
        keys.addAll(required);
        composites.forEach(rule -> keys.addAll(rule.params()));
        keys.addAll(defaults.keySet());
        return Collections.unmodifiableList(new ArrayList<>(keys));
    }
}
