package com.juno.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Juno-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setCycle(String runId, int cycle) {
        MDC.put("runId", runId);
        MDC.put("cycle", String.valueOf(cycle));
    }

    public static void setTeam(String runId, int cycle, String team) {
        setCycle(runId, cycle);
        MDC.put("team", team);
    }

    public static void clearTeam() {
        MDC.remove("team");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("cycle");
        MDC.remove("team");
    }
}
