package com.branchflow.core.gateway;

/**
 * Result of a merge or cherry-pick that ran to completion.
 */
public enum IntegrationOutcome {
    CLEAN,
    /** The target already contains the change; nothing was recorded and nothing is in progress. */
    ALREADY_APPLIED,
    CONFLICTED;

    public boolean isClean() {
        return this != CONFLICTED;
    }
}
