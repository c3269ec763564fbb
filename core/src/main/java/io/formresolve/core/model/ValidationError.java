package io.formresolve.core.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregated outcome of a failed compilation: every violation found in one pass, in the order
 * they were detected. A value, not an exception.
 *
 * @param actionId   the action that was being compiled
 * @param violations all violations, never empty
 */
public record ValidationError(String actionId, List<Violation> violations) {

    public ValidationError {
        violations = List.copyOf(violations);
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("a validation error needs at least one violation");
        }
    }

    /** The violation messages, in detection order. */
    public List<String> messages() {
        return violations.stream().map(Violation::message).collect(Collectors.toList());
    }

    public int size() {
        return violations.size();
    }

    /** One-line summary joining all messages. */
    public String summary() {
        return String.join("; ", messages());
    }
}
