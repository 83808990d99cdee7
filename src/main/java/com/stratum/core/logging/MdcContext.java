package com.stratum.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Stratum-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String FILE_ID = "fileId";
    public static final String BATCH_ID = "batchId";
    public static final String PHASE = "phase";
    public static final String CONTAINER_KEY = "containerKey";

    private MdcContext() {}

    public static void setFile(String fileId) {
        MDC.put(FILE_ID, fileId);
    }

    public static void setPhase(String fileId, String phase) {
        MDC.put(FILE_ID, fileId);
        MDC.put(PHASE, phase);
    }

    public static void setBatch(String fileId, int batchId, String phase) {
        MDC.put(FILE_ID, fileId);
        MDC.put(BATCH_ID, String.valueOf(batchId));
        MDC.put(PHASE, phase);
    }

    public static void setContainer(String fileId, String containerKey) {
        MDC.put(FILE_ID, fileId);
        MDC.put(CONTAINER_KEY, containerKey);
    }

    public static void clear() {
        MDC.remove(FILE_ID);
        MDC.remove(BATCH_ID);
        MDC.remove(PHASE);
        MDC.remove(CONTAINER_KEY);
    }
}
