package com.branchflow.core.model;

import java.util.Set;

/**
 * Outcome of a hotfix propagation that could not be applied automatically.
 *
 * @param sourceRef        commit being integrated
 * @param targetBranch     development branch that was left untouched
 * @param conflictingPaths unmerged paths; empty when git reported a conflict it could not attribute
 * @param resolutionBranch pushed branch holding the partial cherry-pick for a human to finish
 */
public record ConflictReport(
    String sourceRef,
    String targetBranch,
    Set<String> conflictingPaths,
    String resolutionBranch
) {

    public ConflictReport {
        conflictingPaths = Set.copyOf(conflictingPaths);
    }

    /**
     * Copy-pasteable steps for finishing the propagation by hand.
     */
    public String instructions(String remote) {
        return String.join("\n",
                "git fetch " + remote,
                "git checkout " + resolutionBranch,
                "# resolve conflict markers in: "
                        + (conflictingPaths.isEmpty() ? "(paths unknown, run git diff)" : String.join(", ", conflictingPaths.stream().sorted().toList())),
                "git commit -am \"Resolve hotfix " + sourceRef + " into " + targetBranch + "\"",
                "git push " + remote + " " + resolutionBranch,
                "# then merge " + resolutionBranch + " into " + targetBranch);
    }
}
