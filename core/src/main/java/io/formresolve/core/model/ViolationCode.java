package io.formresolve.core.model;

/** Category of a single validation violation. */
public enum ViolationCode {
    MISSING_REQUIRED,
    COMPOSITE_UNSATISFIED,
    INVALID_VALUE,
    DEPENDENCY_NOT_READY
}
