package com.branchflow.dispatch.cli;

import com.branchflow.core.engine.PromotionService;
import com.branchflow.core.model.PromotionResult;
import com.branchflow.core.model.PromotionStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: branchflow plan &lt;branch&gt;
 * <p>
 * Shows what {@code promote} would do without touching the repository.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Show the action a branch event would take")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Branch to plan for")
    private String branch;

    private final PromotionService promotionService;

    public PlanCommand(PromotionService promotionService) {
        this.promotionService = promotionService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        PromotionResult plan = promotionService.plan(branch);
        ConsoleOutput.descriptor(plan.descriptor());
        System.out.println();

        if (plan.status() == PromotionStatus.FAILED) {
            ConsoleOutput.error("Cannot plan: " + plan.error());
            return plan.exitCode();
        }
        if (plan.status() == PromotionStatus.GATE_CLOSED) {
            ConsoleOutput.warn("Completion gate closed; a branch event would only send a tag reminder");
            return 0;
        }
        ConsoleOutput.success("Action: " + plan.action());
        return 0;
    }
}
