package com.craftsman.coordinator.service;

import com.craftsman.coordinator.tool.OperationKind;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A request to hand a sub-task to another role.
 *
 * @param targetRoleId          role that should run the sub-task
 * @param task                  free-text sub-task description
 * @param requestedCapabilities kinds the child should hold; null means the target
 *                              role's full set (still bounded by the delegator's grant)
 * @param timeout               child deadline; null falls back to the configured default,
 *                              and the child never outlives its parent's deadline
 */
public record DelegationRequest(
        String             targetRoleId,
        String             task,
        Set<OperationKind> requestedCapabilities,
        Duration           timeout) {

    public DelegationRequest {
        Objects.requireNonNull(targetRoleId, "targetRoleId");
        task = task == null ? "" : task;
        requestedCapabilities = requestedCapabilities == null ? null : Set.copyOf(requestedCapabilities);
    }

    public static DelegationRequest to(String targetRoleId, String task) {
        return new DelegationRequest(targetRoleId, task, null, null);
    }

    public static DelegationRequest to(String targetRoleId, String task, OperationKind... requested) {
        return new DelegationRequest(targetRoleId, task, new LinkedHashSet<>(Arrays.asList(requested)), null);
    }

    public DelegationRequest withTimeout(Duration timeout) {
        return new DelegationRequest(targetRoleId, task, requestedCapabilities, timeout);
    }
}
