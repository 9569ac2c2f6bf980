package com.branchflow.core.model;

import java.time.Instant;

/**
 * Human-created marker that signs off a branch for promotion.
 *
 * @param targetBranch the branch the tag completes
 * @param createdAt    when the marker was observed on the remote
 */
public record CompletionTag(
    String targetBranch,
    Instant createdAt
) {

    public static final String SUFFIX = "-complete";

    public String tagName() {
        return targetBranch + SUFFIX;
    }
}
