package io.formresolve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.formresolve.core.model.CanonicalGroup;
import io.formresolve.core.model.RuntimeValues;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Picks the effective value of a canonical parameter from the fields that can supply it.
 *
 * <p>
 * The group is walked in its declared precedence order and the first value that is non-empty
 * after trimming wins. The result depends only on that order and on the values, never on map
 * iteration order, so repeated calls with equal inputs return equal results.
 *
 * <p>
 * Thread-safe, stateless.
 */
public final class CanonicalValueResolver {

    /** Resolves over every member of the group. */
    public Optional<JsonNode> resolve(CanonicalGroup group, RuntimeValues values) {
        return resolve(group, values, fieldId -> true);
    }

    /**
     * Resolves over the members accepted by {@code eligible}; the engine passes the active fields so
     * values typed into hidden branches never surface.
     *
     * @return the winning raw value, or empty when no eligible member has one
     */
    public Optional<JsonNode> resolve(CanonicalGroup group, RuntimeValues values, Predicate<String> eligible) {
        for (String fieldId : group.fieldIds()) {
            if (!eligible.test(fieldId)) {
                continue;
            }
            JsonNode candidate = values.get(fieldId);
            if (JsonNodeUtils.hasValue(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
