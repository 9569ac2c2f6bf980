package com.branchflow.core.naming;

import com.branchflow.core.model.BranchDescriptor;
import com.branchflow.core.model.CompletionTag;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Names of the refs Branchflow reads and creates.
 *
 * <ul>
 *   <li>completion tag: {@code {branch}-complete}</li>
 *   <li>release tag: {@code release-{releaseBranch}-{yyyyMMdd.HHmmss}}</li>
 *   <li>hotfix ship tag: {@code hotfix-{nameWithoutPrefix}-{yyyyMMdd.HHmmss}}</li>
 *   <li>resolution branch: {@code merge-hotfix-to-dev-{runId}}</li>
 * </ul>
 * Timestamps are taken from the injected clock in UTC.
 */
@Component
public class ArtifactNames {

    public static final String RESOLUTION_BRANCH_PREFIX = "merge-hotfix-to-dev-";

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd.HHmmss")
            .withZone(ZoneOffset.UTC);

    private final Clock clock;

    public ArtifactNames(Clock clock) {
        this.clock = clock;
    }

    public static String completionTag(String branchName) {
        return branchName + CompletionTag.SUFFIX;
    }

    public static String resolutionBranch(String runId) {
        return RESOLUTION_BRANCH_PREFIX + runId;
    }

    public static String tagRef(String tagName) {
        return "refs/tags/" + tagName;
    }

    /**
     * The command an operator runs to sign off a branch.
     */
    public static String tagCommand(String branchName, String remote) {
        String tag = completionTag(branchName);
        return "git tag " + tag + " " + remote + "/" + branchName + " && git push " + remote + " " + tag;
    }

    public String releaseTag(String releaseBranch) {
        return "release-" + releaseBranch + "-" + timestamp();
    }

    public String hotfixTag(BranchDescriptor hotfix) {
        return "hotfix-" + hotfix.nameWithoutHotfixPrefix() + "-" + timestamp();
    }

    public String timestamp() {
        return TIMESTAMP.format(clock.instant());
    }

    public Clock clock() {
        return clock;
    }
}
