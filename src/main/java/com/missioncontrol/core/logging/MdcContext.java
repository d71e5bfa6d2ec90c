package com.missioncontrol.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Mission Control MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPlan(String planId, String workspaceId) {
        MDC.put("planId", planId);
        if (workspaceId != null) {
            MDC.put("workspaceId", workspaceId);
        }
    }

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setClient(String clientId) {
        MDC.put("clientId", clientId);
    }

    public static void clear() {
        MDC.remove("planId");
        MDC.remove("workspaceId");
        MDC.remove("taskId");
        MDC.remove("clientId");
    }
}
