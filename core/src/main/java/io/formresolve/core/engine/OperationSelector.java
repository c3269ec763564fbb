package io.formresolve.core.engine;

import io.formresolve.core.error.UnknownOperationException;
import io.formresolve.core.model.OperationRule;
import io.formresolve.core.model.UnknownValuePolicy;

/**
 * Maps a discriminator value to an action id.
 *
 * <p>
 * A value with no mapping (a missing value included) is handled by the rule's policy: {@code
 * fallback-default} returns the default action, {@code strict-throw} raises
 * {@link UnknownOperationException}. Lookup is exact on the trimmed value.
 */
public final class OperationSelector {

    /**
     * Selects the action for a discriminator value.
     *
     * @param discriminatorValue trimmed discriminator text, or {@code null} when not supplied
     * @param rule               the schema's operation rule
     * @return the selected action id
     * @throws UnknownOperationException on a miss under {@code strict-throw} (schema id left
     *                                   {@code null}; the engine fills it in)
     */
    public String selectAction(String discriminatorValue, OperationRule rule) {
        if (discriminatorValue != null) {
            String mapped = rule.mapping().get(discriminatorValue);
            if (mapped != null) {
                return mapped;
            }
        }
        if (rule.unknownValuePolicy() == UnknownValuePolicy.FALLBACK_DEFAULT && rule.defaultActionId() != null) {
            return rule.defaultActionId();
        }
        throw new UnknownOperationException(discriminatorValue, null);
    }
}
