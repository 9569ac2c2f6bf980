package com.branchflow.core.model;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed view of a branch name, built fresh for every branch event.
 *
 * <p>{@code sequenceId} is present only for development and release branches.
 * {@code parentReleaseId} is only meaningful for hotfixes; it is either parsed
 * from the name or filled in once through {@link #withParentRelease(BigInteger)}.
 *
 * @param rawName         the branch name exactly as received
 * @param kind            lifecycle stage of the branch
 * @param sequenceId      numeric suffix of {@code d{n}} / {@code r{n}}, any number of digits; null otherwise
 * @param parentReleaseId release number a hotfix targets, null when unresolved
 */
public record BranchDescriptor(
    String rawName,
    BranchKind kind,
    BigInteger sequenceId,
    BigInteger parentReleaseId
) {

    public static final String HOTFIX_PREFIX = "hotfix/";

    public BranchDescriptor {
        Objects.requireNonNull(rawName, "rawName");
        Objects.requireNonNull(kind, "kind");
        boolean sequenced = kind == BranchKind.DEVELOPMENT || kind == BranchKind.RELEASE;
        if (sequenced != (sequenceId != null)) {
            throw new IllegalArgumentException(
                    "sequenceId must be present exactly for development and release branches: " + rawName);
        }
        if (parentReleaseId != null && kind != BranchKind.HOTFIX) {
            throw new IllegalArgumentException("Only hotfix branches carry a parent release: " + rawName);
        }
    }

    public Optional<BigInteger> sequence() {
        return Optional.ofNullable(sequenceId);
    }

    public Optional<BigInteger> parentRelease() {
        return Optional.ofNullable(parentReleaseId);
    }

    public boolean hasParentRelease() {
        return parentReleaseId != null;
    }

    /**
     * Returns the parent release branch name ({@code r{n}}).
     *
     * @throws IllegalStateException if the parent release has not been resolved
     */
    public String parentReleaseBranch() {
        if (parentReleaseId == null) {
            throw new IllegalStateException("Parent release not resolved for " + rawName);
        }
        return "r" + parentReleaseId;
    }

    public BranchDescriptor withParentRelease(long releaseId) {
        return withParentRelease(BigInteger.valueOf(releaseId));
    }

    /**
     * Fills in the parent release of a hotfix whose name carried no release token.
     * A parent that is already resolved is never replaced.
     */
    public BranchDescriptor withParentRelease(BigInteger releaseId) {
        Objects.requireNonNull(releaseId, "releaseId");
        if (kind != BranchKind.HOTFIX) {
            throw new IllegalStateException("Not a hotfix branch: " + rawName);
        }
        if (parentReleaseId != null) {
            throw new IllegalStateException(
                    "Parent release of " + rawName + " already resolved to r" + parentReleaseId);
        }
        return new BranchDescriptor(rawName, kind, null, releaseId);
    }

    /**
     * Hotfix name with the {@code hotfix/} prefix removed; other names unchanged.
     */
    public String nameWithoutHotfixPrefix() {
        return rawName.startsWith(HOTFIX_PREFIX) ? rawName.substring(HOTFIX_PREFIX.length()) : rawName;
    }
}
