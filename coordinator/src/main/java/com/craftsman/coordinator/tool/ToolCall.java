package com.craftsman.coordinator.tool;

import java.util.Map;

/**
 * Runtime context handed to a {@link ToolOperation}.
 *
 * Operations see only what they need to act and to tag logs: the owning
 * role and the arguments. They never receive the TaskContext itself, so
 * they cannot delegate or bypass the gateway.
 */
public record ToolCall(String rootTaskId, String roleId, OperationKind kind, Map<String, Object> args) {

    public ToolCall {
        args = args == null ? Map.of() : Map.copyOf(args);
    }

    public String stringArg(String name) {
        Object v = args.get(name);
        return v == null ? null : v.toString();
    }
}
