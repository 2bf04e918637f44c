package com.craftsman.coordinator.tool;

import java.time.Instant;

/**
 * One audit entry written by the gateway for every invocation attempt.
 *
 * @param operation  requested kind
 * @param status     "success", "denied", "error", "cancelled" or "step_limit"
 * @param detail     denial reason or collaborator error message; null on success
 * @param at         when the gateway received the request
 * @param durationMs wall-clock time spent in the collaborator (0 when not called)
 */
public record ToolInvocationRecord(
        OperationKind operation,
        String        status,
        String        detail,
        Instant       at,
        long          durationMs) {

    public boolean granted() {
        return "success".equals(status) || "error".equals(status);
    }
}
