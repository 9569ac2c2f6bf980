package com.branchflow.core.gateway;

import java.util.List;
import java.util.Set;

/**
 * Capability interface over a single repository and its remote.
 *
 * <p>Every call blocks until the operation completes and signals failure by
 * throwing {@link GatewayException}. Merge and cherry-pick conflicts are not
 * failures; they are reported through {@link IntegrationOutcome}.
 *
 * <p>Implementations operate on one working tree and are not safe for
 * concurrent use. Callers serialize access per repository.
 */
public interface VcsGateway {

    /** Fetches all branches and tags from the remote, pruning deleted refs. */
    void fetchAll();

    /**
     * Lists branch names present on the remote.
     *
     * @param prefix name prefix to filter by; empty for all branches
     */
    List<String> listRemoteBranches(String prefix);

    /**
     * Lists tag names present on the remote, queried live.
     *
     * @param pattern exact tag name or a glob where {@code *} matches any run of characters
     */
    List<String> listRemoteTags(String pattern);

    /**
     * Switches the working tree to {@code ref}. A branch that exists on the
     * remote is reset to the remote tip.
     */
    void checkout(String ref);

    /** Creates (or resets) local branch {@code name} at {@code from} and checks it out. */
    void createBranch(String name, String from);

    /** Pushes {@code ref} (branch name or {@code refs/tags/...}) to the remote. */
    void push(String ref);

    /** Creates annotated tag {@code name} on {@code target}. */
    void tag(String name, String target, String message);

    /**
     * Merges {@code source} into {@code target}, leaving {@code target} checked out.
     *
     * <p>With {@link MergeStrategy#NO_FAST_FORWARD} a conflicted merge is aborted
     * before returning. With {@link MergeStrategy#TRIAL_NO_COMMIT} nothing is
     * committed and the merge state is left for the caller to {@link #abortMerge()}.
     */
    IntegrationOutcome merge(String source, String target, MergeStrategy strategy);

    /** Abandons an in-progress merge, restoring the pre-merge working tree. No-op if none. */
    void abortMerge();

    /**
     * Applies {@code commit} as a single new commit on top of {@code onto}.
     * On conflict the markers are left in the working tree.
     */
    IntegrationOutcome cherryPick(String commit, String onto);

    /** Abandons an in-progress cherry-pick. No-op if none. */
    void abortCherryPick();

    /** Paths currently in the unmerged state. */
    Set<String> diffUnmergedPaths();

    /**
     * Stages everything in the working tree and commits it, creating an empty
     * placeholder commit when nothing is stageable.
     *
     * @return the new head commit
     */
    String commitAll(String message);

    /** Commit id of the checked-out head. */
    String currentHeadCommit();

    /** Name of the remote this gateway talks to (e.g. {@code origin}). */
    String remoteName();
}
