package com.foreman.core.logging;

import org.slf4j.MDC;

/**
 * Foreman MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setTask(String runId, String taskId, String owner) {
        MDC.put("runId", runId);
        MDC.put("taskId", taskId);
        MDC.put("owner", owner);
    }

    public static void setPass(String runId, int passNumber) {
        MDC.put("runId", runId);
        MDC.put("passNumber", String.valueOf(passNumber));
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("taskId");
        MDC.remove("owner");
        MDC.remove("passNumber");
    }
}
