package com.branchflow.core.gate;

import com.branchflow.core.gateway.VcsGateway;
import com.branchflow.core.metrics.BranchflowMetrics;
import com.branchflow.core.model.BranchDescriptor;
import com.branchflow.core.model.BranchKind;
import com.branchflow.core.model.CompletionTag;
import com.branchflow.core.naming.ArtifactNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Decides whether a branch has been signed off for promotion.
 *
 * <p>A branch is complete when the remote carries the tag
 * {@code {branch}-complete}. The remote is asked on every call; tags pushed
 * between two pipeline runs (or seconds before this one) are always seen.
 * Master is never gated.
 */
@Component
public class CompletionGate {

    private static final Logger log = LoggerFactory.getLogger(CompletionGate.class);

    private final Clock clock;
    private final BranchflowMetrics metrics;

    public CompletionGate(Clock clock, @Autowired(required = false) BranchflowMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    public boolean isComplete(BranchDescriptor descriptor, VcsGateway gateway) {
        if (descriptor.kind() == BranchKind.MASTER) {
            return true;
        }
        boolean complete = findCompletionTag(descriptor, gateway).isPresent();
        log.info("Completion gate for {} ({}): {}", descriptor.rawName(), descriptor.kind(),
                complete ? "open" : "closed");
        if (metrics != null) {
            metrics.recordGateCheck(descriptor.kind(), complete);
        }
        return complete;
    }

    /**
     * Looks up the completion tag of a branch on the remote.
     */
    public Optional<CompletionTag> findCompletionTag(BranchDescriptor descriptor, VcsGateway gateway) {
        String tagName = ArtifactNames.completionTag(descriptor.rawName());
        return gateway.listRemoteTags(tagName).contains(tagName)
                ? Optional.of(new CompletionTag(descriptor.rawName(), clock.instant()))
                : Optional.empty();
    }

    /**
     * Command text an operator must run to open the gate for {@code descriptor}.
     */
    public String tagCommandText(BranchDescriptor descriptor, VcsGateway gateway) {
        return ArtifactNames.tagCommand(descriptor.rawName(), gateway.remoteName());
    }
}
