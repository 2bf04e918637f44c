package com.craftsman.coordinator.logging;

import org.slf4j.MDC;

/**
 * MDC keys carried by every log line emitted while a task runs on a worker.
 *
 * Set by the router around each behavior run and always cleared in a
 * finally block, since pool threads are reused across tasks.
 */
public final class MdcContext {

    public static final String ROOT_TASK_ID = "rootTaskId";
    public static final String TASK_ID      = "taskId";
    public static final String ROLE         = "role";
    public static final String DEPTH        = "depth";

    private MdcContext() {}

    public static void setTask(String rootTaskId, long taskId, String role, int depth) {
        MDC.put(ROOT_TASK_ID, rootTaskId);
        MDC.put(TASK_ID, String.valueOf(taskId));
        MDC.put(ROLE, role);
        MDC.put(DEPTH, String.valueOf(depth));
    }

    public static void clear() {
        MDC.remove(ROOT_TASK_ID);
        MDC.remove(TASK_ID);
        MDC.remove(ROLE);
        MDC.remove(DEPTH);
    }
}
