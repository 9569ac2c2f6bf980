package com.branchflow.core.gate;

import com.branchflow.core.gateway.VcsGateway;
import com.branchflow.core.model.BranchDescriptor;
import com.branchflow.core.model.BranchKind;
import com.branchflow.core.naming.BranchClassifier;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Query functions that locate lifecycle branches on the remote.
 *
 * <p>Both functions read the remote through the gateway on every call and
 * hold no state between events.
 */
public final class BranchResolver {

    private BranchResolver() {
        // utility class
    }

    /**
     * Resolves the parent release of a hotfix. A release parsed from the name
     * wins; otherwise the highest {@code r{n}} on the remote is used.
     *
     * @return the descriptor with its parent release filled in
     * @throws NoReleaseBranchException if no release can be found
     */
    public static BranchDescriptor resolveParentRelease(BranchDescriptor hotfix, VcsGateway gateway) {
        if (hotfix.kind() != BranchKind.HOTFIX) {
            throw new IllegalArgumentException("Not a hotfix branch: " + hotfix.rawName());
        }
        if (hotfix.hasParentRelease()) {
            return hotfix;
        }
        return latestOfKind(gateway, "r", BranchKind.RELEASE)
                .map(release -> hotfix.withParentRelease(release.sequenceId()))
                .orElseThrow(() -> new NoReleaseBranchException(hotfix.rawName()));
    }

    /**
     * The current development branch: the {@code d{n}} with the highest {@code n} on the remote.
     */
    public static Optional<BranchDescriptor> resolveCurrentDevBranch(VcsGateway gateway) {
        return latestOfKind(gateway, "d", BranchKind.DEVELOPMENT);
    }

    /**
     * Remote branches of the given kind ordered by sequence, ascending.
     */
    static List<BranchDescriptor> branchesOfKind(VcsGateway gateway, String prefix, BranchKind kind) {
        return gateway.listRemoteBranches(prefix).stream()
                .map(BranchClassifier::classify)
                .filter(d -> d.kind() == kind)
                .sorted(Comparator.comparing(BranchDescriptor::sequenceId))
                .toList();
    }

    private static Optional<BranchDescriptor> latestOfKind(VcsGateway gateway, String prefix, BranchKind kind) {
        List<BranchDescriptor> ordered = branchesOfKind(gateway, prefix, kind);
        return ordered.isEmpty() ? Optional.empty() : Optional.of(ordered.get(ordered.size() - 1));
    }
}
