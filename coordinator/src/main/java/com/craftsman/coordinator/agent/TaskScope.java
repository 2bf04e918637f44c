package com.craftsman.coordinator.agent;

import com.craftsman.coordinator.model.Outcome;
import com.craftsman.coordinator.role.CapabilitySet;
import com.craftsman.coordinator.service.DelegationRequest;
import com.craftsman.coordinator.tool.OperationKind;

import java.util.List;
import java.util.Map;

/**
 * What a running behavior can see and do.
 */
public interface TaskScope {

    String task();

    String roleId();

    /** The role's persona text, as configured. */
    String persona();

    int depth();

    /** Effective capabilities of this task. */
    CapabilitySet capabilities();

    /**
     * Invoke a tool operation through the gateway.
     *
     * @throws com.craftsman.coordinator.tool.CapabilityDeniedException if not permitted
     * @throws com.craftsman.coordinator.tool.ToolInvocationException   if the collaborator failed
     */
    Object invoke(OperationKind kind, Map<String, Object> args);

    /** Delegate with the target role's default capabilities. Blocks until the child resolves. */
    Outcome delegate(String targetRoleId, String task);

    Outcome delegate(DelegationRequest request);

    /** Run several delegations concurrently; outcomes come back in request order. */
    List<Outcome> delegateAll(List<DelegationRequest> requests);

    /** Outcomes of every delegation this task has consumed so far, in request order. */
    List<Outcome> aggregatedView();

    boolean isCancelled();
}
