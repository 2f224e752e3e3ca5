package io.taskmesh.logging;

import org.slf4j.MDC;

/**
 * MDC keys attached to log lines while an agent works a task.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setAgent(String agentId, String role) {
        MDC.put("agentId", agentId);
        MDC.put("role", role);
    }

    public static void setTask(String agentId, String taskId) {
        MDC.put("agentId", agentId);
        MDC.put("taskId", taskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("agentId");
        MDC.remove("role");
        MDC.remove("taskId");
    }
}
