package com.parallax.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Parallax-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String GROUP_ID = "groupId";
    public static final String WORKSPACE_ID = "workspaceId";
    public static final String PHASE = "phase";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setWorkspace(String runId, String groupId, String workspaceId) {
        MDC.put(RUN_ID, runId);
        MDC.put(GROUP_ID, groupId);
        MDC.put(WORKSPACE_ID, workspaceId);
    }

    public static void setPhase(String phase) {
        MDC.put(PHASE, phase);
    }

    public static String currentRunId() {
        return MDC.get(RUN_ID);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(GROUP_ID);
        MDC.remove(WORKSPACE_ID);
        MDC.remove(PHASE);
    }
}
