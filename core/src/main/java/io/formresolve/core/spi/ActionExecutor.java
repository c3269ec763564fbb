package io.formresolve.core.spi;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Downstream collaborator that performs the backend call for a compiled action.
 *
 * <p>
 * Only ever invoked with a payload that passed validation (see {@code
 * CompileResult#dispatchTo}). Implementations own their retry and timeout policy; the engine does
 * not retry.
 *
 * @param <R> the executor's response type
 */
@FunctionalInterface
public interface ActionExecutor<R> {

    /**
     * Executes an action.
     *
     * @param schemaId block type the payload was compiled for
     * @param actionId the selected backend action
     * @param payload  validated, typed payload; owned by the executor
     * @return the executor's response, may be {@code null}
     */
    R execute(String schemaId, String actionId, ObjectNode payload);
}
