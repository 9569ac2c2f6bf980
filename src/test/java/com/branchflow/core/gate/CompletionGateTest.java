package com.branchflow.core.gate;

import com.branchflow.core.metrics.BranchflowMetrics;
import com.branchflow.core.naming.BranchClassifier;
import com.branchflow.testing.InMemoryVcsGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CompletionGateTest {

    private InMemoryVcsGateway gateway;
    private SimpleMeterRegistry registry;
    private CompletionGate gate;

    @BeforeEach
    void setUp() {
        gateway = new InMemoryVcsGateway();
        gateway.initBranch("master", Map.of("a", "1"));
        gateway.branchFrom("d7", "master");
        gateway.branchFrom("r6", "master");
        registry = new SimpleMeterRegistry();
        gate = new CompletionGate(Clock.fixed(Instant.EPOCH, ZoneOffset.UTC), new BranchflowMetrics(registry));
    }

    @Test
    @DisplayName("closed without a completion tag")
    void closedWithoutTag() {
        assertFalse(gate.isComplete(BranchClassifier.classify("d7"), gateway));
    }

    @Test
    @DisplayName("open once {branch}-complete exists on the remote")
    void openWithTag() {
        gateway.remoteTag("d7-complete", "d7");
        assertTrue(gate.isComplete(BranchClassifier.classify("d7"), gateway));
    }

    @Test
    @DisplayName("a tag for another branch does not open the gate")
    void otherBranchTag() {
        gateway.remoteTag("r6-complete", "r6");
        gateway.remoteTag("d77-complete", "d7");
        assertFalse(gate.isComplete(BranchClassifier.classify("d7"), gateway));
    }

    @Test
    @DisplayName("the remote is queried on every call")
    void notCached() {
        var d7 = BranchClassifier.classify("d7");
        assertFalse(gate.isComplete(d7, gateway));
        gateway.remoteTag("d7-complete", "d7");
        assertTrue(gate.isComplete(d7, gateway));
        assertEquals(2, gateway.calls().stream().filter(c -> c.startsWith("list-remote-tags:")).count());
    }

    @Test
    @DisplayName("master is never gated and never queried")
    void masterOpen() {
        assertTrue(gate.isComplete(BranchClassifier.classify("master"), gateway));
        assertTrue(gateway.calls().isEmpty());
    }

    @Test
    @DisplayName("hotfix gate uses the full hotfix branch name")
    void hotfixTag() {
        gateway.branchFrom("hotfix/r6-x", "r6");
        var hotfix = BranchClassifier.classify("hotfix/r6-x");
        assertFalse(gate.isComplete(hotfix, gateway));
        gateway.remoteTag("hotfix/r6-x-complete", "hotfix/r6-x");
        assertTrue(gate.isComplete(hotfix, gateway));
    }

    @Test
    @DisplayName("findCompletionTag returns the tag name")
    void findTag() {
        gateway.remoteTag("r6-complete", "r6");
        var tag = gate.findCompletionTag(BranchClassifier.classify("r6"), gateway);
        assertTrue(tag.isPresent());
        assertEquals("r6-complete", tag.get().tagName());
    }

    @Test
    @DisplayName("gate checks are counted by result")
    void metrics() {
        gate.isComplete(BranchClassifier.classify("d7"), gateway);
        var closed = registry.find("branchflow.gate.checks").tag("result", "closed").tag("kind", "development").counter();
        assertNotNull(closed);
        assertEquals(1.0, closed.count());
    }

    @Test
    @DisplayName("tag command text points at the remote branch")
    void tagCommandText() {
        assertEquals("git tag d7-complete origin/d7 && git push origin d7-complete",
                gate.tagCommandText(BranchClassifier.classify("d7"), gateway));
    }
}
