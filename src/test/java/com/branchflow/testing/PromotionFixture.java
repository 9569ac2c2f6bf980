package com.branchflow.testing;

import com.branchflow.core.config.BranchflowProperties;
import com.branchflow.core.conflict.ConflictResolver;
import com.branchflow.core.engine.PromotionEngine;
import com.branchflow.core.engine.PromotionService;
import com.branchflow.core.engine.RepositoryLocks;
import com.branchflow.core.engine.RunIdGenerator;
import com.branchflow.core.events.EventBus;
import com.branchflow.core.events.EventNotifier;
import com.branchflow.core.events.PromotionEvent;
import com.branchflow.core.gate.CompletionGate;
import com.branchflow.core.metrics.BranchflowMetrics;
import com.branchflow.core.naming.ArtifactNames;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Wires the promotion components by hand around an {@link InMemoryVcsGateway},
 * with a fixed clock at 2026-03-14T09:26:53Z.
 */
public class PromotionFixture {

    public static final Instant NOW = Instant.parse("2026-03-14T09:26:53Z");
    public static final String STAMP = "20260314.092653";

    public final InMemoryVcsGateway gateway;
    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    public final EventBus eventBus = new EventBus();
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final BranchflowMetrics metrics = new BranchflowMetrics(registry);
    public final BranchflowProperties properties = new BranchflowProperties();
    public final EventNotifier notifier = new EventNotifier(eventBus, clock);
    public final ArtifactNames artifactNames = new ArtifactNames(clock);
    public final CompletionGate completionGate = new CompletionGate(clock, metrics);
    public final ConflictResolver conflictResolver = new ConflictResolver();
    public final PromotionEngine engine;
    public final PromotionService service;

    /** Every event published on the bus, across runs. */
    public final List<PromotionEvent> published = new CopyOnWriteArrayList<>();

    public PromotionFixture() {
        this(new InMemoryVcsGateway());
    }

    public PromotionFixture(InMemoryVcsGateway gateway) {
        this.gateway = gateway;
        this.engine = new PromotionEngine(completionGate, conflictResolver, notifier, artifactNames, properties, metrics);
        this.service = new PromotionService(gateway, completionGate, engine, notifier, eventBus,
                new RepositoryLocks(), new RunIdGenerator(clock), metrics);
        eventBus.subscribeAll("fixture", published::add);
    }
}
