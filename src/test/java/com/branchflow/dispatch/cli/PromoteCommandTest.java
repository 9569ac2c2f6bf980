package com.branchflow.dispatch.cli;

import com.branchflow.core.engine.PromotionService;
import com.branchflow.core.model.PromotionAction;
import com.branchflow.core.model.PromotionResult;
import com.branchflow.core.model.PromotionStatus;
import com.branchflow.core.naming.BranchClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PromoteCommandTest {

    @Mock
    private PromotionService promotionService;

    private CommandLine promote;
    private CommandLine plan;

    @BeforeEach
    void setUp() {
        promote = new CommandLine(new PromoteCommand(promotionService));
        plan = new CommandLine(new PlanCommand(promotionService));
    }

    private PromotionResult result(String branch, PromotionAction action, PromotionStatus status) {
        return new PromotionResult("run-1", BranchClassifier.classify(branch), action, status, List.of(),
                status == PromotionStatus.FAILED ? "boom" : null);
    }

    @Test
    @DisplayName("promote passes the run id and exits 0 on completion")
    void completed() {
        when(promotionService.promote("d7", "ci-42"))
                .thenReturn(result("d7", new PromotionAction.CreateRelease("d7", 7), PromotionStatus.COMPLETED));

        assertEquals(0, promote.execute("d7", "--run-id", "ci-42"));
    }

    @Test
    @DisplayName("promote without a run id lets the service generate one")
    void generatedRunId() {
        when(promotionService.promote("master", null))
                .thenReturn(result("master", new PromotionAction.Noop("end"), PromotionStatus.NOOP));

        assertEquals(0, promote.execute("master"));
        verify(promotionService).promote("master", null);
    }

    @Test
    @DisplayName("promote exits 2 when a resolution branch awaits a human")
    void conflict() {
        when(promotionService.promote(eq("hotfix/r3-x"), isNull()))
                .thenReturn(result("hotfix/r3-x", null, PromotionStatus.CONFLICT));

        assertEquals(2, promote.execute("hotfix/r3-x"));
    }

    @Test
    @DisplayName("promote exits 1 on failure")
    void failed() {
        when(promotionService.promote("r4", "ci-9"))
                .thenReturn(result("r4", new PromotionAction.MergeToMaster("r4"), PromotionStatus.FAILED));

        assertEquals(1, promote.execute("r4", "-r", "ci-9"));
    }

    @Test
    @DisplayName("promote without a branch is a usage error")
    void missingBranch() {
        assertEquals(2, promote.execute());
    }

    @Test
    @DisplayName("plan exits 0 for a closed gate and 1 for a failure")
    void planExitCodes() {
        when(promotionService.plan("r5")).thenReturn(result("r5", null, PromotionStatus.GATE_CLOSED));
        when(promotionService.plan("hotfix/x")).thenReturn(result("hotfix/x", null, PromotionStatus.FAILED));

        assertEquals(0, plan.execute("r5"));
        assertEquals(1, plan.execute("hotfix/x"));
    }

    @Test
    @DisplayName("classify accepts any branch name")
    void classify() {
        assertEquals(0, new CommandLine(new ClassifyCommand()).execute("feature/login"));
    }
}
