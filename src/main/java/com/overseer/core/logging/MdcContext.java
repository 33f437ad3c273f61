package com.overseer.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Overseer-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String REQUEST_ID = "requestId";
    public static final String PHASE = "phase";
    public static final String TASK_ID = "taskId";
    public static final String WORKER_ID = "workerId";

    private MdcContext() {}

    public static void setRequest(String requestId) {
        MDC.put(REQUEST_ID, requestId);
    }

    public static void setPhase(String requestId, String phase) {
        MDC.put(REQUEST_ID, requestId);
        MDC.put(PHASE, phase);
    }

    public static void setWorker(String requestId, String phase, String taskId, String workerId) {
        MDC.put(REQUEST_ID, requestId);
        MDC.put(PHASE, phase);
        MDC.put(TASK_ID, taskId);
        MDC.put(WORKER_ID, workerId);
    }

    public static void clearPhase() {
        MDC.remove(PHASE);
        MDC.remove(TASK_ID);
        MDC.remove(WORKER_ID);
    }

    public static void clearWorker() {
        MDC.remove(TASK_ID);
        MDC.remove(WORKER_ID);
    }

    public static void clear() {
        MDC.remove(REQUEST_ID);
        MDC.remove(PHASE);
        MDC.remove(TASK_ID);
        MDC.remove(WORKER_ID);
    }
}
