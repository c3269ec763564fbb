package io.formresolve.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-request resolution snapshot produced by {@code FormResolver}. Sets preserve schema field
 * order; {@code canonicalValues} holds only canonical ids that resolved to a non-empty value.
 *
 * @param visible         fields whose condition holds
 * @param ready           fields whose dependencies all have non-empty effective values
 * @param canonicalValues effective value per canonical id, resolved from active fields only
 */
public record ResolvedForm(Set<String> visible, Set<String> ready, Map<String, JsonNode> canonicalValues) {

    public ResolvedForm {
        visible = Collections.unmodifiableSet(new LinkedHashSet<>(visible));
        ready = Collections.unmodifiableSet(new LinkedHashSet<>(ready));
        canonicalValues = Collections.unmodifiableMap(new LinkedHashMap<>(canonicalValues));
    }

    public boolean isVisible(String fieldId) {
        return visible.contains(fieldId);
    }

    public boolean isReady(String fieldId) {
        return ready.contains(fieldId);
    }

    /** A field is active when it is both visible and ready. */
    public boolean isActive(String fieldId) {
        return visible.contains(fieldId) && ready.contains(fieldId);
    }

    /** Active fields, in schema field order. */
    public Set<String> active() {
        Set<String> active = new LinkedHashSet<>(visible);
        active.retainAll(ready);
        return Collections.unmodifiableSet(active);
    }

    public Optional<JsonNode> canonicalValue(String canonicalParamId) {
        return Optional.ofNullable(canonicalValues.get(canonicalParamId));
    }
}
