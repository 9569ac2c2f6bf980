package com.branchflow.core.conflict;

import com.branchflow.core.gateway.GatewayException;
import com.branchflow.core.gateway.IntegrationOutcome;
import com.branchflow.core.gateway.MergeStrategy;
import com.branchflow.core.gateway.VcsGateway;
import com.branchflow.core.model.ConflictReport;
import com.branchflow.core.model.PropagationResult;
import com.branchflow.core.naming.ArtifactNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Propagates a hotfix commit into a development branch without ever leaving
 * that branch in a conflicted state.
 *
 * <p>A trial merge (always aborted) decides the path. A clean trial leads to a
 * cherry-pick of the commit onto the branch, keeping development history linear.
 * A conflicted trial leads to a resolution branch {@code merge-hotfix-to-dev-{runId}}
 * cut from the development tip, seeded with the conflicted cherry-pick and
 * pushed for a human to finish. The development branch is not touched on that path.
 *
 * <p>Stateless; the caller supplies a {@code runId} distinct per pipeline execution.
 */
@Component
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    public PropagationResult propagate(VcsGateway gateway, String sourceCommit, String targetBranch, String runId) {
        log.info("Propagating {} into {} (run {})", sourceCommit, targetBranch, runId);
        try {
            gateway.checkout(targetBranch);

            IntegrationOutcome trial = trialMerge(gateway, sourceCommit, targetBranch);
            if (trial == IntegrationOutcome.ALREADY_APPLIED) {
                return alreadyPresent(gateway, sourceCommit, targetBranch);
            }
            if (trial.isClean()) {
                return apply(gateway, sourceCommit, targetBranch, runId);
            }
            return materializeResolutionBranch(gateway, sourceCommit, targetBranch, runId);
        } catch (GatewayException e) {
            log.error("Propagation of {} into {} failed at '{}': {}",
                    sourceCommit, targetBranch, e.operation(), e.getMessage());
            return new PropagationResult.Failed(targetBranch, e);
        }
    }

    private IntegrationOutcome trialMerge(VcsGateway gateway, String sourceCommit, String targetBranch) {
        IntegrationOutcome outcome;
        try {
            outcome = gateway.merge(sourceCommit, targetBranch, MergeStrategy.TRIAL_NO_COMMIT);
        } catch (GatewayException e) {
            try {
                gateway.abortMerge();
            } catch (GatewayException abortFailure) {
                e.addSuppressed(abortFailure);
            }
            throw e;
        }
        gateway.abortMerge();
        log.info("Trial merge of {} into {}: {}", sourceCommit, targetBranch, outcome);
        return outcome;
    }

    private PropagationResult apply(VcsGateway gateway, String sourceCommit, String targetBranch, String runId) {
        IntegrationOutcome picked = gateway.cherryPick(sourceCommit, targetBranch);
        if (picked == IntegrationOutcome.ALREADY_APPLIED) {
            return alreadyPresent(gateway, sourceCommit, targetBranch);
        }
        if (!picked.isClean()) {
            // Trial merge and cherry-pick disagree; treat as a conflict and keep the target untouched
            log.warn("Cherry-pick of {} onto {} conflicted after a clean trial merge", sourceCommit, targetBranch);
            gateway.abortCherryPick();
            gateway.checkout(targetBranch);
            return materializeResolutionBranch(gateway, sourceCommit, targetBranch, runId);
        }
        gateway.push(targetBranch);
        String head = gateway.currentHeadCommit();
        log.info("Hotfix {} applied to {} as {}", sourceCommit, targetBranch, head);
        return new PropagationResult.Applied(targetBranch, head, false);
    }

    private PropagationResult alreadyPresent(VcsGateway gateway, String sourceCommit, String targetBranch) {
        String head = gateway.currentHeadCommit();
        log.info("{} already contains hotfix {}; nothing to push", targetBranch, sourceCommit);
        return new PropagationResult.Applied(targetBranch, head, true);
    }

    private PropagationResult materializeResolutionBranch(VcsGateway gateway, String sourceCommit,
                                                          String targetBranch, String runId) {
        String resolutionBranch = ArtifactNames.resolutionBranch(runId);
        log.warn("Conflict propagating {} into {}; creating resolution branch {}",
                sourceCommit, targetBranch, resolutionBranch);

        gateway.createBranch(resolutionBranch, targetBranch);
        IntegrationOutcome picked = gateway.cherryPick(sourceCommit, resolutionBranch);
        Set<String> conflictingPaths = gateway.diffUnmergedPaths();
        boolean conflicted = picked == IntegrationOutcome.CONFLICTED;
        if (!conflicted) {
            log.info("Cherry-pick onto {} applied cleanly; branch still pushed for review", resolutionBranch);
        }

        gateway.commitAll(!conflicted
                ? "Hotfix " + sourceCommit + " for " + targetBranch + ": review before merging"
                : "WIP: conflicted hotfix " + sourceCommit + " for " + targetBranch + ", resolve markers in "
                        + (conflictingPaths.isEmpty() ? "(unknown paths)" : String.join(", ", conflictingPaths)));
        gateway.push(resolutionBranch);

        // Leave the working tree on the untouched target
        gateway.checkout(targetBranch);

        var report = new ConflictReport(sourceCommit, targetBranch, conflictingPaths, resolutionBranch);
        log.warn("Resolution branch {} pushed; conflicting paths: {}", resolutionBranch, conflictingPaths);
        return new PropagationResult.ConflictDetected(report);
    }
}
