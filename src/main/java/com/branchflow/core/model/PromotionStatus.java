package com.branchflow.core.model;

/**
 * Terminal status of a single branch event.
 */
public enum PromotionStatus {
    COMPLETED(0),
    NOOP(0),
    GATE_CLOSED(0),  // Completion tag missing, reminder sent
    CONFLICT(2),     // Resolution branch pushed, needs a human
    FAILED(1);

    private final int exitCode;

    PromotionStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
