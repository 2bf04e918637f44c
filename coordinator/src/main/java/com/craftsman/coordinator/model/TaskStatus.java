package com.craftsman.coordinator.model;

/**
 * Lifecycle state of a single TaskContext.
 *
 * Transitions:
 *   PENDING   → RUNNING    (claimed by a worker)
 *   PENDING   → FAILED     (cancelled or timed out before it started)
 *   RUNNING   → DELEGATED  (first delegate() call)
 *   RUNNING   → SUCCEEDED | FAILED
 *   DELEGATED → SUCCEEDED | FAILED
 *
 * DELEGATED never returns to RUNNING: a delegated task resumes only through
 * the aggregated results of its children.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    DELEGATED,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING   -> next == RUNNING || next == FAILED;
            case RUNNING   -> next == DELEGATED || next.isTerminal();
            case DELEGATED -> next == DELEGATED || next.isTerminal();
            case SUCCEEDED, FAILED -> false;
        };
    }
}
