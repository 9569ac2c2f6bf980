package com.branchflow.core.gateway;

import com.branchflow.core.engine.PromotionException;

/**
 * A repository operation failed for a reason other than a merge conflict
 * (network, authentication, missing ref, tool error).
 */
public class GatewayException extends PromotionException {

    private final String operation;

    public GatewayException(String operation, String detail) {
        super(operation + " failed: " + detail);
        this.operation = operation;
    }

    public GatewayException(String operation, String detail, Throwable cause) {
        super(operation + " failed: " + detail, cause);
        this.operation = operation;
    }

    /** Name of the gateway operation that failed (e.g. {@code push}). */
    public String operation() {
        return operation;
    }

    @Override
    public String instructions() {
        return "The '" + operation + "' step failed. Steps before it are already on the remote; "
                + "fix the repository access problem and re-run the pipeline for this branch.";
    }
}
