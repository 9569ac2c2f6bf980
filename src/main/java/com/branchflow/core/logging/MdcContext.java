package com.branchflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Branchflow-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId, String branch) {
        MDC.put("runId", runId);
        MDC.put("branch", branch);
    }

    public static void setRepository(String repository) {
        MDC.put("repository", repository);
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("branch");
        MDC.remove("repository");
    }
}
