package com.foreman.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Foreman-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProject(String projectId) {
        MDC.put("projectId", projectId);
    }

    public static void setTask(String projectId, String taskId, String agentId) {
        MDC.put("projectId", projectId);
        MDC.put("taskId", taskId);
        if (agentId != null) {
            MDC.put("agentId", agentId);
        }
    }

    /** Drops the task and agent keys, keeping the project. */
    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("agentId");
    }

    public static void clear() {
        MDC.remove("projectId");
        MDC.remove("taskId");
        MDC.remove("agentId");
    }
}
