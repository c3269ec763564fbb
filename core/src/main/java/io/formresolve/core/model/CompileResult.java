package io.formresolve.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.formresolve.core.spi.ActionExecutor;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of compiling runtime values into an action payload. Exactly one of three states:
 *
 * <ul>
 * <li>{@link Type#VALID}: {@code actionId} and {@code payload} are set.
 * <li>{@link Type#INVALID}: {@code validationError} lists every violation; no payload.
 * <li>{@link Type#UNKNOWN_OPERATION}: the discriminator value had no mapping under a strict
 * policy; {@code unknownValue} holds it (may be {@code null} when nothing was supplied).
 * </ul>
 */
public final class CompileResult {

    /** The type of compilation outcome. */
    public enum Type {
        VALID,
        INVALID,
        UNKNOWN_OPERATION
    }

    private final Type type;
    private final String schemaId;
    private final String actionId;
    private final ObjectNode payload;
    private final ValidationError validationError;
    private final String unknownValue;

    private CompileResult(
            Type type,
            String schemaId,
            String actionId,
            ObjectNode payload,
            ValidationError validationError,
            String unknownValue) {
        this.type = type;
        this.schemaId = schemaId;
        this.actionId = actionId;
        this.payload = payload;
        this.validationError = validationError;
        this.unknownValue = unknownValue;
    }

    /** Creates a VALID result. The payload is copied so later changes by the caller are not seen. */
    public static CompileResult valid(String schemaId, String actionId, ObjectNode payload) {
        Objects.requireNonNull(actionId, "actionId must not be null for VALID");
        Objects.requireNonNull(payload, "payload must not be null for VALID");
        return new CompileResult(Type.VALID, schemaId, actionId, payload.deepCopy(), null, null);
    }

    /** Creates an INVALID result carrying the aggregated error. */
    public static CompileResult invalid(String schemaId, ValidationError error) {
        Objects.requireNonNull(error, "error must not be null for INVALID");
        return new CompileResult(Type.INVALID, schemaId, error.actionId(), null, error, null);
    }

    /** Creates an UNKNOWN_OPERATION result for the rejected discriminator value. */
    public static CompileResult unknownOperation(String schemaId, String value) {
        return new CompileResult(Type.UNKNOWN_OPERATION, schemaId, null, null, null, value);
    }

    public Type type() {
        return type;
    }

    public String schemaId() {
        return schemaId;
    }

    /** The selected action. Set for VALID and INVALID, {@code null} for UNKNOWN_OPERATION. */
    public String actionId() {
        return actionId;
    }

    /** Returns a copy of the payload. Only valid when {@code type() == VALID}. */
    public ObjectNode payload() {
        return payload != null ? payload.deepCopy() : null;
    }

    /** Only valid when {@code type() == INVALID}. */
    public ValidationError validationError() {
        return validationError;
    }

    /** Only meaningful when {@code type() == UNKNOWN_OPERATION}. */
    public String unknownValue() {
        return unknownValue;
    }

    public boolean isValid() {
        return type == Type.VALID;
    }

    public boolean isInvalid() {
        return type == Type.INVALID;
    }

    public boolean isUnknownOperation() {
        return type == Type.UNKNOWN_OPERATION;
    }

    /** Human-readable reason for a rejected result, {@code null} when VALID. */
    public String detail() {
        return switch (type) {
            case VALID -> null;
            case INVALID -> validationError.summary();
            case UNKNOWN_OPERATION -> "Unknown operation: "
                    + (unknownValue != null ? "'" + unknownValue + "'" : "<missing>");
        };
    }

    /**
     * Hands a VALID payload to the downstream executor. Rejected results never reach it.
     *
     * @return the executor's response, or empty when this result is not VALID
     */
    public <R> Optional<R> dispatchTo(ActionExecutor<R> executor) {
        Objects.requireNonNull(executor, "executor must not be null");
        if (!isValid()) {
            return Optional.empty();
        }
        return Optional.ofNullable(executor.execute(schemaId, actionId, payload.deepCopy()));
    }

    @Override
    public String toString() {
        return switch (type) {
            case VALID -> "CompileResult[VALID, schema=" + schemaId + ", action=" + actionId + ", keys="
                    + payload.size() + "]";
            case INVALID -> "CompileResult[INVALID, schema=" + schemaId + ", action=" + actionId + ", violations="
                    + validationError.size() + "]";
            case UNKNOWN_OPERATION -> "CompileResult[UNKNOWN_OPERATION, schema=" + schemaId + "]";
        };
    }
}
