package com.craftsman.coordinator.model;

/**
 * Typed failure categories reported by the coordinator.
 *
 * UNKNOWN_ROLE and DUPLICATE_ROLE are configuration errors and abort startup
 * when they come from the role table. Every other kind is local to the
 * TaskContext that raised it and reaches the parent as a failed Outcome.
 */
public enum ErrorKind {
    UNKNOWN_ROLE,
    DUPLICATE_ROLE,
    CAPABILITY_DENIED,
    DELEGATION_LOOP,
    DEPTH_EXCEEDED,
    CANCELLED,
    TIMEOUT,
    TOOL_INVOCATION_ERROR,
    STEP_LIMIT_EXCEEDED,    // role's maxSteps tool budget used up
    BEHAVIOR_UNAVAILABLE    // no RoleBehavior bound for the role
}
