package io.formresolve.core.model;

import java.util.Objects;

/**
 * One problem found while compiling an action payload.
 *
 * @param code    violation category
 * @param param   canonical id the violation concerns; for composite rules, the first member
 * @param message human-readable description
 */
public record Violation(ViolationCode code, String param, String message) {

    public Violation {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
