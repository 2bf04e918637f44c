package com.craftsman.coordinator.tool;

import com.craftsman.coordinator.model.CoordinationException;
import com.craftsman.coordinator.model.ErrorKind;

/**
 * Wraps a failure reported by an external tool collaborator.
 *
 * The collaborator's exception is kept, unmodified, as {@link #getCause()}.
 * {@link #isRetryable()} mirrors the operation's idempotent flag: the router
 * only re-runs a task for failures of idempotent operations.
 */
public class ToolInvocationException extends CoordinationException {

    private final OperationKind operation;
    private final boolean       retryable;

    public ToolInvocationException(OperationKind operation, boolean retryable, String message, Throwable cause) {
        super(ErrorKind.TOOL_INVOCATION_ERROR, message, cause);
        this.operation = operation;
        this.retryable = retryable;
    }

    public OperationKind getOperation() { return operation; }
    public boolean isRetryable()        { return retryable; }
}
