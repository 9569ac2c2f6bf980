package com.branchflow.core.engine;

import com.branchflow.core.events.EventBus;
import com.branchflow.core.events.EventKind;
import com.branchflow.core.events.EventNotifier;
import com.branchflow.core.events.PromotionEvent;
import com.branchflow.core.gate.BranchResolver;
import com.branchflow.core.gate.CompletionGate;
import com.branchflow.core.gateway.GatewayException;
import com.branchflow.core.gateway.VcsGateway;
import com.branchflow.core.logging.MdcContext;
import com.branchflow.core.metrics.BranchflowMetrics;
import com.branchflow.core.model.BranchDescriptor;
import com.branchflow.core.model.BranchKind;
import com.branchflow.core.model.PromotionAction;
import com.branchflow.core.model.PromotionResult;
import com.branchflow.core.model.PromotionStatus;
import com.branchflow.core.naming.BranchClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Processes one branch event end to end: classify, resolve, gate, decide, execute.
 * <p>
 * Holds the repository lock for the whole event so that at most one action
 * touches the working tree at a time. Every failure is surfaced in the
 * returned {@link PromotionResult} (status FAILED) and as a
 * {@code promotion.failed} event; nothing is retried.
 */
@Service
public class PromotionService {

    private static final Logger log = LoggerFactory.getLogger(PromotionService.class);

    private final VcsGateway gateway;
    private final CompletionGate completionGate;
    private final PromotionEngine engine;
    private final EventNotifier notifier;
    private final EventBus eventBus;
    private final RepositoryLocks repositoryLocks;
    private final RunIdGenerator runIdGenerator;
    private final BranchflowMetrics metrics;

    public PromotionService(VcsGateway gateway,
                            CompletionGate completionGate,
                            PromotionEngine engine,
                            EventNotifier notifier,
                            EventBus eventBus,
                            RepositoryLocks repositoryLocks,
                            RunIdGenerator runIdGenerator,
                            @Autowired(required = false) BranchflowMetrics metrics) {
        this.gateway = gateway;
        this.completionGate = completionGate;
        this.engine = engine;
        this.notifier = notifier;
        this.eventBus = eventBus;
        this.repositoryLocks = repositoryLocks;
        this.runIdGenerator = runIdGenerator;
        this.metrics = metrics;
    }

    /**
     * Handles a branch event with a generated run id.
     */
    public PromotionResult promote(String branchName) {
        return promote(branchName, runIdGenerator.next());
    }

    /**
     * Handles a branch event (new commits or a completion tag pushed).
     *
     * @param branchName the branch the event is about
     * @param runId      pipeline execution id; names the resolution branch if one is needed
     * @return the outcome, with the events emitted for this run in order
     */
    public PromotionResult promote(String branchName, String runId) {
        if (runId == null || runId.isBlank()) {
            runId = runIdGenerator.next();
        }
        List<PromotionEvent> events = new ArrayList<>();
        ReentrantLock lock = repositoryLocks.lockFor(repositoryKey());
        long start = System.currentTimeMillis();

        MdcContext.setRun(runId, branchName);
        MdcContext.setRepository(repositoryKey());
        lock.lock();
        try (EventBus.Subscription ignored = eventBus.subscribe(runId, events::add)) {
            log.info("Run {} processing branch event for '{}'", runId, branchName);
            PromotionResult result = process(branchName, runId, events);
            log.info("Run {} finished for '{}': {} ({})", runId, branchName, result.status(),
                    result.action() == null ? "no action" : result.action().name());
            recordMetrics(result, start);
            return result;
        } finally {
            lock.unlock();
            MdcContext.clear();
        }
    }

    /**
     * Works out what {@link #promote} would do for a branch without changing
     * the repository or emitting events.
     */
    public PromotionResult plan(String branchName) {
        String runId = "plan";
        ReentrantLock lock = repositoryLocks.lockFor(repositoryKey());
        lock.lock();
        try {
            BranchDescriptor descriptor = BranchClassifier.classify(branchName);
            if (descriptor.kind() == BranchKind.MASTER || descriptor.kind() == BranchKind.UNKNOWN) {
                return new PromotionResult(runId, descriptor, engine.decide(descriptor),
                        PromotionStatus.NOOP, List.of(), null);
            }
            gateway.fetchAll();
            if (descriptor.kind() == BranchKind.HOTFIX) {
                descriptor = BranchResolver.resolveParentRelease(descriptor, gateway);
            }
            if (!completionGate.isComplete(descriptor, gateway)) {
                return new PromotionResult(runId, descriptor, null, PromotionStatus.GATE_CLOSED, List.of(), null);
            }
            PromotionAction action = engine.decide(descriptor);
            return new PromotionResult(runId, descriptor, action, PromotionStatus.COMPLETED, List.of(), null);
        } catch (PromotionException e) {
            return new PromotionResult(runId, BranchClassifier.classify(branchName), null,
                    PromotionStatus.FAILED, List.of(), e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private PromotionResult process(String branchName, String runId, List<PromotionEvent> events) {
        BranchDescriptor descriptor = BranchClassifier.classify(branchName);
        log.info("Classified '{}' as {}", branchName, descriptor.kind());

        if (descriptor.kind() == BranchKind.MASTER || descriptor.kind() == BranchKind.UNKNOWN) {
            PromotionAction noop = engine.decide(descriptor);
            return new PromotionResult(runId, descriptor, noop,
                    engine.execute(new RunContext(runId, branchName, gateway), noop), events, null);
        }

        PromotionAction action = null;
        try {
            gateway.fetchAll();

            if (descriptor.kind() == BranchKind.HOTFIX) {
                descriptor = BranchResolver.resolveParentRelease(descriptor, gateway);
                log.info("Hotfix {} targets release {}", branchName, descriptor.parentReleaseBranch());
            }

            if (!completionGate.isComplete(descriptor, gateway)) {
                String command = completionGate.tagCommandText(descriptor, gateway);
                notifier.emit(runId, branchName, EventKind.TAG_REMINDER, Map.of(
                        "branchKind", descriptor.kind().name(),
                        "branchName", branchName,
                        "tagCommandText", command,
                        "instructions", "Branch " + branchName + " is not signed off. When it is ready run: " + command));
                return new PromotionResult(runId, descriptor, null, PromotionStatus.GATE_CLOSED, events, null);
            }

            action = engine.decide(descriptor);
            log.info("Selected action {} for {}", action.name(), branchName);
            PromotionStatus status = engine.execute(new RunContext(runId, branchName, gateway), action);
            return new PromotionResult(runId, descriptor, action, status, events,
                    status == PromotionStatus.FAILED ? "hotfix propagation to development failed" : null);
        } catch (PromotionException e) {
            log.error("Run {} for '{}' failed: {}", runId, branchName, e.getMessage(), e);
            notifier.emit(runId, branchName, EventKind.PROMOTION_FAILED, failurePayload(branchName, e));
            return new PromotionResult(runId, descriptor, action, PromotionStatus.FAILED, events, e.getMessage());
        }
    }

    private Map<String, Object> failurePayload(String branchName, PromotionException e) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("branchName", branchName);
        payload.put("operation", e instanceof GatewayException g ? g.operation() : e.getClass().getSimpleName());
        payload.put("error", e.getMessage());
        payload.put("instructions", e.instructions());
        return payload;
    }

    private void recordMetrics(PromotionResult result, long start) {
        if (metrics == null) {
            return;
        }
        String action = result.action() == null ? "none" : result.action().name();
        metrics.recordPromotion(action, result.status().name().toLowerCase(), System.currentTimeMillis() - start);
    }

    private String repositoryKey() {
        return gateway.remoteName() + "@" + gateway.getClass().getSimpleName() + "#"
                + System.identityHashCode(gateway);
    }
}
