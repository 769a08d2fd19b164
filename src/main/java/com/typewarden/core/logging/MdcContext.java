package com.typewarden.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing campaign-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setBatch(String batchId) {
        MDC.put("batchId", batchId);
    }

    public static void setFile(String batchId, String filePath) {
        MDC.put("batchId", batchId);
        MDC.put("filePath", filePath);
    }

    public static void clearFile() {
        MDC.remove("filePath");
    }

    public static void setMonitorTick(long tickNumber) {
        MDC.put("monitorTick", String.valueOf(tickNumber));
    }

    public static void clear() {
        MDC.remove("batchId");
        MDC.remove("filePath");
        MDC.remove("monitorTick");
    }
}
