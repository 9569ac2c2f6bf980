package com.branchflow.core.model;

import java.math.BigInteger;

/**
 * The single lifecycle action selected for a branch event.
 */
public sealed interface PromotionAction {

    /** Short name used in logs, metrics and API responses. */
    String name();

    /** Cut release {@code r{n}} from development branch {@code d{n}}. */
    record CreateRelease(String fromDev, BigInteger releaseId) implements PromotionAction {
        public CreateRelease(String fromDev, long releaseId) {
            this(fromDev, BigInteger.valueOf(releaseId));
        }

        public String releaseBranch() {
            return "r" + releaseId;
        }

        @Override
        public String name() {
            return "create-release";
        }
    }

    /** Tag a release and merge it into master. */
    record MergeToMaster(String fromBranch) implements PromotionAction {
        @Override
        public String name() {
            return "merge-to-master";
        }
    }

    /** Deliver a hotfix into its parent release and the current development branch. */
    record PropagateHotfix(String hotfixBranch, String parentRelease) implements PromotionAction {
        @Override
        public String name() {
            return "propagate-hotfix";
        }
    }

    /** Parent release is not signed off yet; master merge waits for its own event. */
    record AwaitReleaseCompletion(String parentRelease) implements PromotionAction {
        @Override
        public String name() {
            return "await-release-completion";
        }
    }

    record Noop(String reason) implements PromotionAction {
        @Override
        public String name() {
            return "noop";
        }
    }
}
