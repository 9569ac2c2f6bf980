package com.branchflow.dispatch.cli;

import com.branchflow.core.engine.PromotionService;
import com.branchflow.core.model.PromotionResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: branchflow promote &lt;branch&gt;
 * <p>
 * Processes one branch event: the CI job calls this whenever commits or a
 * completion tag land on a branch. Exit code 0 covers completed, no-op and
 * gate-closed runs; 2 means a resolution branch awaits a human; 1 is a failure.
 */
@Command(name = "promote", mixinStandardHelpOptions = true, description = "Process a branch event")
@Component
public class PromoteCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Branch the event is about (d<N>, r<N>, hotfix/..., master)")
    private String branch;

    @Option(names = {"--run-id", "-r"}, description = "Pipeline execution id (defaults to a generated id)")
    private String runId;

    private final PromotionService promotionService;

    public PromoteCommand(PromotionService promotionService) {
        this.promotionService = promotionService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Processing branch " + branch + "...");

        PromotionResult result = promotionService.promote(branch, runId);

        ConsoleOutput.descriptor(result.descriptor());
        System.out.println();
        result.events().forEach(ConsoleOutput::event);
        ConsoleOutput.result(result);
        return result.exitCode();
    }
}
