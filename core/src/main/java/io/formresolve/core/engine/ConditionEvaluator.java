package io.formresolve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.formresolve.core.model.Condition;
import io.formresolve.core.model.RuntimeValues;

/**
 * Evaluates visibility conditions against raw input values.
 *
 * <p>
 * Semantics, per link of the {@code and} chain:
 * <ul>
 * <li>the current value is compared as trimmed text; numbers and booleans through their text
 * form</li>
 * <li>a missing or null value matches only when the condition lists {@code null}</li>
 * <li>arrays and objects never match</li>
 * <li>{@code negate} inverts the membership result</li>
 * <li>a condition with an empty value list is false whatever {@code negate} says</li>
 * </ul>
 *
 * <p>
 * Thread-safe, stateless.
 */
public final class ConditionEvaluator {

    /**
     * Evaluates a condition chain.
     *
     * @param condition the condition, or {@code null} (always true)
     * @param values    current raw values
     * @return whether every link of the chain holds
     */
    public boolean evaluate(Condition condition, RuntimeValues values) {
        for (Condition link = condition; link != null; link = link.and()) {
            if (!evaluateLink(link, values)) {
                return false;
            }
        }
        return true;
    }

    private boolean evaluateLink(Condition link, RuntimeValues values) {
        if (link.isEmptyList()) {
            return false;
        }
        boolean matched = matches(link, values.get(link.field()));
        return link.negate() != matched;
    }

    private static boolean matches(Condition link, JsonNode current) {
        if (JsonNodeUtils.isAbsent(current)) {
            return link.matchesAbsent();
        }
        String text = JsonNodeUtils.scalarText(current);
        return text != null && link.values().contains(text);
    }
}
