package com.branchflow.core.gateway;

/**
 * How {@link VcsGateway#merge} integrates a source into a target.
 */
public enum MergeStrategy {
    NO_FAST_FORWARD,
    TRIAL_NO_COMMIT
}
