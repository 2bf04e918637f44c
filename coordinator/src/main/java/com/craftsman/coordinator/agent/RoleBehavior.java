package com.craftsman.coordinator.agent;

/**
 * Work a role performs when one of its tasks runs.
 *
 * Implementations are Spring beans; the coordinator looks them up by
 * {@link #roleId()}. A behavior reaches the outside world only through its
 * {@link TaskScope}: tool calls go through the gateway and sub-tasks through
 * delegation.
 *
 * Failures: a thrown CoordinationException keeps its kind, a failed delegated
 * outcome re-raised with {@code orThrow()} keeps the child's failure, and any
 * other exception fails the task as TOOL_INVOCATION_ERROR.
 */
public interface RoleBehavior {

    String roleId();

    Object perform(TaskScope scope) throws Exception;
}
