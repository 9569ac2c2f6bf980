package com.branchflow.dispatch.cli;

import com.branchflow.core.health.HealthCheckService;
import com.branchflow.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: branchflow health
 * <p>
 * Runs all health checks and displays results with colored output.
 * Exits 1 when git or the working tree is down, since no promotion could run.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean blocked = false;
        for (HealthStatus check : healthCheckService.checkAll()) {
            String label = check.component().key() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
            if (check.remedy() != null) {
                System.out.println("    -> " + check.remedy());
            }
            blocked |= check.blocksPromotion();
        }

        System.out.println("──────────────────────────────────");
        if (blocked) {
            ConsoleOutput.error("Overall: cannot promote");
            return 1;
        }
        ConsoleOutput.success("Overall: ready to promote");
        return 0;
    }
}
