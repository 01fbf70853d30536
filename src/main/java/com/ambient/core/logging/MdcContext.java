package com.ambient.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing orchestrator-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setNamespace(String namespace) {
        MDC.put("namespace", namespace);
    }

    public static void setSession(String namespace, String sessionName) {
        MDC.put("namespace", namespace);
        MDC.put("session", sessionName);
    }

    public static void setWorkflow(String namespace, String workflowId) {
        MDC.put("namespace", namespace);
        MDC.put("workflow", workflowId);
    }

    public static void clear() {
        MDC.remove("namespace");
        MDC.remove("session");
        MDC.remove("workflow");
    }
}
