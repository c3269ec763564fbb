package io.formresolve.core.model;

import java.util.List;
import java.util.function.Predicate;

/**
 * Cross-field requirement over several canonical parameters of one action.
 *
 * <p>
 * Implementations are a sealed hierarchy; all variants are known at compile time.
 */
public sealed interface CompositeRule {

    /** The canonical ids the rule inspects, in declaration order. */
    List<String> params();

    /**
     * Returns {@code true} if the rule holds.
     *
     * @param present tells whether a canonical id has a non-empty value
     */
    boolean isSatisfiedBy(Predicate<String> present);

    /** Human-readable rule description used in violation messages. */
    String describe();

    /** At least one of the params must be non-empty. */
    record AnyOf(List<String> params) implements CompositeRule {

        public AnyOf {
            params = List.copyOf(params);
        }

        @Override
        public boolean isSatisfiedBy(Predicate<String> present) {
            return params.stream().anyMatch(present);
        }

        @Override
        public String describe() {
            return "at least one of " + params + " must be provided";
        }
    }

    /** No more than one of the params may be non-empty. */
    record AtMostOneOf(List<String> params) implements CompositeRule {

        public AtMostOneOf {
            params = List.copyOf(params);
        }

        @Override
        public boolean isSatisfiedBy(Predicate<String> present) {
            return params.stream().filter(present).count() <= 1;
        }

        @Override
        public String describe() {
            return "at most one of " + params + " may be provided";
        }
    }
}
