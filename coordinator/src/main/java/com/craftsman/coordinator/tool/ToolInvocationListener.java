package com.craftsman.coordinator.tool;

/**
 * Observer hooks around gateway invocations.
 *
 * Listeners observe only: they run after the capability decision and
 * cannot change it. An exception thrown by a listener is logged by the
 * gateway and never fails the invocation.
 */
public interface ToolInvocationListener {

    /** Called after the capability check passed, before the collaborator runs. */
    default void beforeInvoke(ToolCall call) {}

    /** Called after the collaborator returned normally. */
    default void afterInvoke(ToolCall call, Object result) {}

    /** Called for denials and for collaborator failures. */
    default void onFailure(ToolCall call, RuntimeException error) {}
}
