package com.branchflow.core.engine;

import com.branchflow.core.config.BranchflowProperties;
import com.branchflow.core.conflict.ConflictResolver;
import com.branchflow.core.events.EventKind;
import com.branchflow.core.events.EventNotifier;
import com.branchflow.core.gate.BranchResolver;
import com.branchflow.core.gate.CompletionGate;
import com.branchflow.core.gateway.GatewayException;
import com.branchflow.core.gateway.IntegrationOutcome;
import com.branchflow.core.gateway.MergeStrategy;
import com.branchflow.core.gateway.VcsGateway;
import com.branchflow.core.metrics.BranchflowMetrics;
import com.branchflow.core.model.BranchDescriptor;
import com.branchflow.core.model.PromotionAction;
import com.branchflow.core.model.PromotionStatus;
import com.branchflow.core.model.PropagationResult;
import com.branchflow.core.naming.ArtifactNames;
import com.branchflow.core.naming.BranchClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The promotion state machine.
 *
 * <p>{@link #decide} maps a gated-open branch to exactly one
 * {@link PromotionAction}; {@link #execute} carries it out through the gateway.
 * Sub-steps are durable as soon as they succeed and are never rolled back;
 * a gateway failure halts the action where it happened.
 */
@Service
public class PromotionEngine {

    private static final Logger log = LoggerFactory.getLogger(PromotionEngine.class);

    private final CompletionGate completionGate;
    private final ConflictResolver conflictResolver;
    private final EventNotifier notifier;
    private final ArtifactNames artifactNames;
    private final String masterBranch;
    private final BranchflowMetrics metrics;

    public PromotionEngine(CompletionGate completionGate,
                           ConflictResolver conflictResolver,
                           EventNotifier notifier,
                           ArtifactNames artifactNames,
                           BranchflowProperties properties,
                           @Autowired(required = false) BranchflowMetrics metrics) {
        this.completionGate = completionGate;
        this.conflictResolver = conflictResolver;
        this.notifier = notifier;
        this.artifactNames = artifactNames;
        this.masterBranch = properties.getMasterBranch();
        this.metrics = metrics;
    }

    /**
     * Selects the action for a branch whose completion gate is open.
     * Hotfix descriptors must have their parent release resolved.
     */
    public PromotionAction decide(BranchDescriptor descriptor) {
        return switch (descriptor.kind()) {
            case DEVELOPMENT -> new PromotionAction.CreateRelease(descriptor.rawName(), descriptor.sequenceId());
            case RELEASE -> new PromotionAction.MergeToMaster(descriptor.rawName());
            case HOTFIX -> new PromotionAction.PropagateHotfix(descriptor.rawName(), descriptor.parentReleaseBranch());
            case MASTER -> new PromotionAction.Noop("master is the end of the lifecycle");
            case UNKNOWN -> new PromotionAction.Noop(
                    "'" + descriptor.rawName() + "' matches no branch grammar (d<N>, r<N>, hotfix/..., master)");
        };
    }

    /**
     * Runs an action to its terminal step.
     *
     * @return COMPLETED, NOOP, CONFLICT or FAILED
     * @throws PromotionException when a step fails before any independent work remains
     */
    public PromotionStatus execute(RunContext run, PromotionAction action) {
        if (action instanceof PromotionAction.CreateRelease createRelease) {
            return createRelease(run, createRelease);
        }
        if (action instanceof PromotionAction.MergeToMaster mergeToMaster) {
            mergeToMaster(run, mergeToMaster.fromBranch());
            return PromotionStatus.COMPLETED;
        }
        if (action instanceof PromotionAction.PropagateHotfix propagateHotfix) {
            return propagateHotfix(run, propagateHotfix);
        }
        if (action instanceof PromotionAction.Noop noop) {
            log.info("No promotion for {}: {}", run.branch(), noop.reason());
            return PromotionStatus.NOOP;
        }
        if (action instanceof PromotionAction.AwaitReleaseCompletion await) {
            emitAwaiting(run, await.parentRelease());
            return PromotionStatus.COMPLETED;
        }
        throw new IllegalArgumentException("Unsupported action: " + action);
    }

    // -- Development -> Release ---------------------------------------------------

    private PromotionStatus createRelease(RunContext run, PromotionAction.CreateRelease action) {
        VcsGateway gateway = run.gateway();
        String release = action.releaseBranch();
        if (gateway.listRemoteBranches(release).contains(release)) {
            log.info("Release branch {} already exists on the remote; nothing to create", release);
            return PromotionStatus.NOOP;
        }

        gateway.checkout(action.fromDev());
        String head = gateway.currentHeadCommit();
        gateway.createBranch(release, action.fromDev());
        gateway.push(release);
        log.info("Created release {} from {} at {}", release, action.fromDev(), head);

        notifier.emit(run.runId(), run.branch(), EventKind.RELEASE_CREATED, Map.of(
                "fromDev", action.fromDev(),
                "newRelease", release,
                "commit", head,
                "instructions", "When " + release + " is ready for production run: "
                        + ArtifactNames.tagCommand(release, gateway.remoteName())));
        return PromotionStatus.COMPLETED;
    }

    // -- Release -> Master --------------------------------------------------------

    /**
     * Tags the release head, merges the release into master with a merge commit and pushes.
     */
    void mergeToMaster(RunContext run, String releaseBranch) {
        VcsGateway gateway = run.gateway();

        gateway.checkout(releaseBranch);
        String head = gateway.currentHeadCommit();
        String tagName = artifactNames.releaseTag(releaseBranch);
        gateway.tag(tagName, head, "Release " + releaseBranch + " deployed by run " + run.runId());
        gateway.push(ArtifactNames.tagRef(tagName));

        IntegrationOutcome merged = gateway.merge(releaseBranch, masterBranch, MergeStrategy.NO_FAST_FORWARD);
        if (!merged.isClean()) {
            throw new GatewayException("merge",
                    "merging " + releaseBranch + " into " + masterBranch + " conflicts; resolve by hand with: "
                            + "git checkout " + masterBranch + " && git merge --no-ff "
                            + gateway.remoteName() + "/" + releaseBranch);
        }
        gateway.push(masterBranch);
        log.info("Release {} merged into {} and tagged {}", releaseBranch, masterBranch, tagName);

        notifier.emit(run.runId(), run.branch(), EventKind.RELEASE_DEPLOYED, Map.of(
                "releaseBranch", releaseBranch,
                "tagName", tagName,
                "commit", head));
    }

    // -- Hotfix -> Release (-> Master) and -> Development -------------------------

    private PromotionStatus propagateHotfix(RunContext run, PromotionAction.PropagateHotfix action) {
        VcsGateway gateway = run.gateway();
        BranchDescriptor hotfix = BranchClassifier.classify(action.hotfixBranch());

        // 1. Immutable record of what shipped
        gateway.checkout(action.hotfixBranch());
        String hotfixHead = gateway.currentHeadCommit();
        String shipTag = artifactNames.hotfixTag(hotfix);
        gateway.tag(shipTag, hotfixHead, "Hotfix " + action.hotfixBranch() + " shipped by run " + run.runId());
        gateway.push(ArtifactNames.tagRef(shipTag));
        log.info("Tagged hotfix {} at {} as {}", action.hotfixBranch(), hotfixHead, shipTag);

        // 2-3. Release line; 4 runs whatever happens here
        RuntimeException releaseFailure = null;
        try {
            propagateToRelease(run, action);
        } catch (RuntimeException e) {
            releaseFailure = e;
            log.error("Hotfix {} could not be delivered to {}: {}",
                    action.hotfixBranch(), action.parentRelease(), e.getMessage());
        }

        // 4. Development line
        PromotionStatus devStatus = propagateToDevelopment(run, hotfixHead);

        if (releaseFailure != null) {
            throw releaseFailure;
        }
        return devStatus;
    }

    private void propagateToRelease(RunContext run, PromotionAction.PropagateHotfix action) {
        VcsGateway gateway = run.gateway();
        String release = action.parentRelease();

        IntegrationOutcome merged = gateway.merge(action.hotfixBranch(), release, MergeStrategy.NO_FAST_FORWARD);
        if (!merged.isClean()) {
            throw new GatewayException("merge",
                    "merging " + action.hotfixBranch() + " into " + release + " conflicts; resolve by hand with: "
                            + "git checkout " + release + " && git merge --no-ff "
                            + gateway.remoteName() + "/" + action.hotfixBranch());
        }
        gateway.push(release);
        log.info("Hotfix {} merged into release {}", action.hotfixBranch(), release);

        BranchDescriptor releaseDescriptor = BranchClassifier.classify(release);
        if (completionGate.isComplete(releaseDescriptor, gateway)) {
            log.info("Release {} is already complete; promoting it to {}", release, masterBranch);
            mergeToMaster(run, release);
        } else {
            emitAwaiting(run, release);
        }
    }

    private PromotionStatus propagateToDevelopment(RunContext run, String hotfixHead) {
        VcsGateway gateway = run.gateway();
        Optional<BranchDescriptor> dev;
        try {
            dev = BranchResolver.resolveCurrentDevBranch(gateway);
        } catch (GatewayException e) {
            notifier.emit(run.runId(), run.branch(), EventKind.PROPAGATION_FAILED, failurePayload("(unresolved)", hotfixHead, e));
            record("failed");
            return PromotionStatus.FAILED;
        }
        if (dev.isEmpty()) {
            log.warn("No development branch on the remote; hotfix {} not propagated to development", hotfixHead);
            return PromotionStatus.COMPLETED;
        }

        String targetDev = dev.get().rawName();
        PropagationResult result = conflictResolver.propagate(gateway, hotfixHead, targetDev, run.runId());
        if (result instanceof PropagationResult.Applied applied) {
            notifier.emit(run.runId(), run.branch(), EventKind.HOTFIX_PROPAGATED, Map.of(
                    "targetDev", targetDev,
                    "commit", applied.newHead(),
                    "alreadyPresent", applied.alreadyPresent()));
            record(applied.alreadyPresent() ? "already-present" : "applied");
            return PromotionStatus.COMPLETED;
        }
        if (result instanceof PropagationResult.ConflictDetected conflict) {
            notifier.emit(run.runId(), run.branch(), EventKind.CONFLICT_DETECTED, Map.of(
                    "report", conflict.report(),
                    "instructions", conflict.report().instructions(gateway.remoteName())));
            record("conflict");
            return PromotionStatus.CONFLICT;
        }
        PropagationResult.Failed failed = (PropagationResult.Failed) result;
        notifier.emit(run.runId(), run.branch(), EventKind.PROPAGATION_FAILED,
                failurePayload(targetDev, hotfixHead, failed.error()));
        record("failed");
        return PromotionStatus.FAILED;
    }

    private Map<String, Object> failurePayload(String targetDev, String hotfixHead, RuntimeException error) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("targetDev", targetDev);
        payload.put("error", error.getMessage());
        payload.put("instructions", "Propagate the hotfix by hand: git checkout " + targetDev
                + " && git cherry-pick -x " + hotfixHead + " && git push");
        return payload;
    }

    private void emitAwaiting(RunContext run, String release) {
        notifier.emit(run.runId(), run.branch(), EventKind.AWAITING_RELEASE_COMPLETION, Map.of(
                "parentRelease", release,
                "instructions", "Hotfix is on " + release + ". It reaches " + masterBranch
                        + " once " + release + " is signed off: "
                        + ArtifactNames.tagCommand(release, run.gateway().remoteName())));
    }

    private void record(String outcome) {
        if (metrics != null) {
            metrics.recordPropagation(outcome);
        }
    }
}
