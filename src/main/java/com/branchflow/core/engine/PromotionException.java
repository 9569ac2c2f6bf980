package com.branchflow.core.engine;

/**
 * Base type for failures that halt a promotion action.
 */
public class PromotionException extends RuntimeException {

    public PromotionException(String message) {
        super(message);
    }

    public PromotionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Copy-pasteable next step for whoever picks up the failed run.
     */
    public String instructions() {
        return "Inspect the run log, fix the cause and re-run the pipeline for this branch.";
    }
}
