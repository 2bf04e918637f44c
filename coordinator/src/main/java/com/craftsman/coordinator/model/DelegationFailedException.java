package com.craftsman.coordinator.model;

/**
 * Raised by {@link Outcome#orThrow()} when a behavior chooses to propagate
 * a child's failure instead of handling it.
 *
 * Carries the child's {@link TaskFailure} so the router can report the
 * original kind and delegation chain rather than the parent's.
 */
public class DelegationFailedException extends CoordinationException {

    private final TaskFailure failure;

    public DelegationFailedException(TaskFailure failure) {
        super(failure.kind(), failure.message());
        this.failure = failure;
    }

    public TaskFailure getFailure() { return failure; }
}
