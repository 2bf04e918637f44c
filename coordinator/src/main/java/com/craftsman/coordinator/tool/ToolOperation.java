package com.craftsman.coordinator.tool;

/**
 * An external tool collaborator, one per {@link OperationKind}.
 *
 * File I/O, search and shell execution live outside the coordinator; it
 * only needs their classification ({@link ToolManifest}) and a way to call
 * them. Implementations declared as Spring beans are collected by the
 * {@link ToolCatalog} at startup.
 *
 * Only {@link ToolGateway} ever calls {@link #execute}.
 */
public interface ToolOperation {

    /** Identity, kind and idempotency metadata. */
    ToolManifest manifest();

    /**
     * Perform the operation.
     *
     * @throws Exception any collaborator failure; the gateway wraps it,
     *                   unmodified, as the cause of a ToolInvocationException
     */
    Object execute(ToolCall call) throws Exception;
}
