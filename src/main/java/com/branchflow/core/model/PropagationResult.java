package com.branchflow.core.model;

/**
 * Three-way outcome of propagating a commit into a development branch.
 */
public sealed interface PropagationResult {

    /**
     * The change is on the target branch.
     *
     * @param alreadyPresent true when the target already contained it and nothing was pushed
     */
    record Applied(String targetBranch, String newHead, boolean alreadyPresent) implements PropagationResult {}

    record ConflictDetected(ConflictReport report) implements PropagationResult {}

    record Failed(String targetBranch, RuntimeException error) implements PropagationResult {}
}
