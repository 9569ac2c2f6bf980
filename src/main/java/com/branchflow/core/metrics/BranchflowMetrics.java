package com.branchflow.core.metrics;

import com.branchflow.core.events.EventKind;
import com.branchflow.core.model.BranchKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for branch promotion.
 */
@Service
public class BranchflowMetrics {

    private final MeterRegistry registry;

    public BranchflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPromotion(String action, String status, long ms) {
        Counter.builder("branchflow.promotions.total")
                .tag("action", action)
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("branchflow.promotion.duration")
                .tag("action", action)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGateCheck(BranchKind kind, boolean open) {
        Counter.builder("branchflow.gate.checks")
                .tag("kind", kind.name().toLowerCase())
                .tag("result", open ? "open" : "closed")
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of propagating a hotfix into the development line.
     *
     * @param outcome "applied", "already-present", "conflict" or "failed"
     */
    public void recordPropagation(String outcome) {
        Counter.builder("branchflow.hotfix.propagations")
                .description("Hotfix propagations into the current development branch")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordDeliveryFailure(String subscriber, EventKind kind) {
        Counter.builder("branchflow.events.delivery.failures")
                .description("Events a subscriber failed to take")
                .tag("subscriber", subscriber)
                .tag("event", kind.eventType())
                .register(registry)
                .increment();
    }
}
