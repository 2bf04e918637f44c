package com.craftsman.coordinator.model;

import java.util.List;

/**
 * Typed failure attached to a failed {@link Outcome}.
 *
 * @param kind            taxonomy category
 * @param message         human-readable reason, without the kind prefix
 * @param delegationChain role ids from the root down to the context that failed,
 *                        e.g. {@code [coder, researcher]}; never contains task ids
 */
public record TaskFailure(ErrorKind kind, String message, List<String> delegationChain) {

    public TaskFailure {
        delegationChain = delegationChain == null ? List.of() : List.copyOf(delegationChain);
    }

    public static TaskFailure of(CoordinationException e, List<String> chain) {
        return new TaskFailure(e.getKind(), e.getDetail(), chain);
    }
}
