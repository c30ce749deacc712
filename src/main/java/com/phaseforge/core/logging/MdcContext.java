package com.phaseforge.core.logging;

import org.slf4j.MDC;

/**
 * Run, phase and worker keys for the logging MDC.
 * <p>
 * MDC is thread-local: worker pool threads must set their own keys.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String PHASE = "phase";
    public static final String WORKER = "worker";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setPhase(String runId, String phase) {
        MDC.put(RUN_ID, runId);
        MDC.put(PHASE, phase);
    }

    public static void setWorker(String runId, String phase, String workerId) {
        MDC.put(RUN_ID, runId);
        MDC.put(PHASE, phase);
        MDC.put(WORKER, workerId);
    }

    public static void clearWorker() {
        MDC.remove(WORKER);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(PHASE);
        MDC.remove(WORKER);
    }
}
