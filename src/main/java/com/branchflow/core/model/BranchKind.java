package com.branchflow.core.model;

/**
 * Lifecycle stage a branch belongs to, derived from its name.
 */
public enum BranchKind {
    DEVELOPMENT,
    RELEASE,
    HOTFIX,
    MASTER,
    UNKNOWN     // Name matched no branch grammar
}
