package com.branchflow.dispatch.cli;

import com.branchflow.core.model.BranchKind;
import com.branchflow.core.naming.BranchClassifier;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: branchflow classify &lt;branch&gt;
 */
@Command(name = "classify", mixinStandardHelpOptions = true, description = "Classify a branch name")
@Component
public class ClassifyCommand implements Runnable {

    @Parameters(index = "0", description = "Branch name")
    private String branch;

    @Override
    public void run() {
        var descriptor = BranchClassifier.classify(branch);
        ConsoleOutput.descriptor(descriptor);
        if (descriptor.kind() == BranchKind.UNKNOWN) {
            ConsoleOutput.warn("Not a managed branch; events for it are ignored");
        }
    }
}
