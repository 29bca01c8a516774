package com.analysiswatch.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Analysis Watch MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setGeneration(long generation) {
        MDC.put("generation", String.valueOf(generation));
    }

    public static void setEntity(long generation, String entityId) {
        MDC.put("generation", String.valueOf(generation));
        if (entityId != null) {
            MDC.put("entityId", entityId);
        }
    }

    public static void clear() {
        MDC.remove("generation");
        MDC.remove("entityId");
    }
}
