package com.tessera.core.logging;

import org.slf4j.MDC;

/**
 * Tessera MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String EXECUTION_ID = "executionId";
    public static final String CHANGE_ID = "changeId";

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put(SESSION_ID, sessionId);
    }

    public static void setExecution(String sessionId, String executionId) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(EXECUTION_ID, executionId);
    }

    public static void setChange(String executionId, String changeId) {
        MDC.put(EXECUTION_ID, executionId);
        MDC.put(CHANGE_ID, changeId);
    }

    public static void clearChange() {
        MDC.remove(CHANGE_ID);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(EXECUTION_ID);
        MDC.remove(CHANGE_ID);
    }
}
