package com.branchflow.core.gate;

import com.branchflow.core.engine.PromotionException;

/**
 * A hotfix names no release and the remote has no {@code r{n}} branch to fall back to.
 */
public class NoReleaseBranchException extends PromotionException {

    private final String hotfixBranch;

    public NoReleaseBranchException(String hotfixBranch) {
        super("No release branch found for hotfix " + hotfixBranch
                + ": the name carries no r{n} token and the remote has no r{n} branch");
        this.hotfixBranch = hotfixBranch;
    }

    public String hotfixBranch() {
        return hotfixBranch;
    }

    @Override
    public String instructions() {
        return "Rename the branch to hotfix/r<N>-<description> naming its release, "
                + "or push the release branch r<N> it belongs to, then re-run the pipeline for "
                + hotfixBranch + ".";
    }
}
