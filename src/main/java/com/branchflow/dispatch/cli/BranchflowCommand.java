package com.branchflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Branchflow.
 * Routes to subcommands: promote, plan, classify, health, serve.
 */
@Command(
        name = "branchflow",
        mixinStandardHelpOptions = true,
        version = "Branchflow 0.1.0",
        description = "Branch promotion engine for d<N> -> r<N> -> master with hotfix propagation",
        subcommands = {
                PromoteCommand.class,
                PlanCommand.class,
                ClassifyCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class BranchflowCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
