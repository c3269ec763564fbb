package io.formresolve.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Visibility predicate over the current input values. Immutable.
 *
 * <p>
 * A condition holds when the current value of {@code field} is one of {@code values}; a scalar
 * condition is a one-element list, so list membership is the only form of OR. {@code negate}
 * inverts the membership test and {@code and} chains a further condition that must also hold.
 *
 * @param field         the field whose current value is tested
 * @param values        accepted values, compared as trimmed text
 * @param matchesAbsent whether a missing or null input counts as a match
 * @param negate        inverts the membership result
 * @param and           chained condition, or {@code null}
 */
public record Condition(String field, List<String> values, boolean matchesAbsent, boolean negate, Condition and) {

    public Condition {
        Objects.requireNonNull(field, "field must not be null");
        values = values != null ? Collections.unmodifiableList(new ArrayList<>(values)) : List.of();
    }

    /** Shorthand for a single-value equality condition. */
    public static Condition equalTo(String field, String value) {
        return new Condition(field, List.of(value), false, false, null);
    }

    /** Shorthand for a list-membership condition. */
    public static Condition oneOf(String field, List<String> values) {
        return new Condition(field, values, false, false, null);
    }

    /** Returns a copy of this condition with {@code negate} flipped. */
    public Condition negated() {
        return new Condition(field, values, matchesAbsent, !negate, and);
    }

    /** Returns a copy of this condition whose chain ends with {@code next}. */
    public Condition andThen(Condition next) {
        Condition tail = and == null ? next : and.andThen(next);
        return new Condition(field, values, matchesAbsent, negate, tail);
    }

    /** Returns {@code true} if no value (and no absent marker) can ever match. */
    public boolean isEmptyList() {
        return values.isEmpty() && !matchesAbsent;
    }

    /** All fields referenced along the {@code and} chain, in chain order. */
    public Set<String> referencedFields() {
        Set<String> fields = new LinkedHashSet<>();
        for (Condition c = this; c != null; c = c.and) {
            fields.add(c.field);
        }
        return fields;
    }
}
