package com.craftsman.coordinator.tool;

import com.craftsman.coordinator.model.CoordinationException;
import com.craftsman.coordinator.model.ErrorKind;

/**
 * Thrown when a context asks for an operation outside its capability set,
 * or when a delegation requests capabilities the target (or the delegating
 * parent) does not hold. Never retried.
 */
public class CapabilityDeniedException extends CoordinationException {

    private final OperationKind operation;

    public CapabilityDeniedException(OperationKind operation, String message) {
        super(ErrorKind.CAPABILITY_DENIED, message);
        this.operation = operation;
    }

    public OperationKind getOperation() { return operation; }
}
