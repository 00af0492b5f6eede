package com.talewright.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Talewright-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setPhase(String runId, String phase) {
        MDC.put("runId", runId);
        MDC.put("phase", phase);
    }

    public static void setScene(int sceneNumber) {
        MDC.put("scene", String.valueOf(sceneNumber));
    }

    public static void setAgent(String agent) {
        MDC.put("agent", agent);
    }

    public static void clearPhase() {
        MDC.remove("phase");
    }

    public static void clearScene() {
        MDC.remove("scene");
    }

    public static void clearAgent() {
        MDC.remove("agent");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("phase");
        MDC.remove("scene");
        MDC.remove("agent");
    }
}
