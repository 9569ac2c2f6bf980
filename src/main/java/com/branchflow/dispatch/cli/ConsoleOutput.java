package com.branchflow.dispatch.cli;

import com.branchflow.core.events.PromotionEvent;
import com.branchflow.core.model.BranchDescriptor;
import com.branchflow.core.model.PromotionResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Branchflow CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) BRANCHFLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [BRANCHFLOW]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void descriptor(BranchDescriptor d) {
        System.out.println("  Branch:   " + d.rawName());
        System.out.println("  Kind:     " + d.kind());
        if (d.sequenceId() != null) {
            System.out.println("  Sequence: " + d.sequenceId());
        }
        if (d.hasParentRelease()) {
            System.out.println("  Parent:   " + d.parentReleaseBranch());
        }
    }

    public static void event(PromotionEvent event) {
        String prefix = switch (event.kind()) {
            case TAG_REMINDER, AWAITING_RELEASE_COMPLETION -> "@|fg(yellow) [" + event.eventType() + "]|@";
            case RELEASE_CREATED, RELEASE_DEPLOYED, HOTFIX_PROPAGATED -> "@|fg(green) [" + event.eventType() + "]|@";
            case CONFLICT_DETECTED, PROPAGATION_FAILED, PROMOTION_FAILED -> "@|fg(red),bold [" + event.eventType() + "]|@";
        };
        var details = new StringBuilder();
        event.payload().forEach((key, value) -> {
            if (!"instructions".equals(key)) {
                details.append(details.length() == 0 ? "" : ", ").append(key).append('=').append(value);
            }
        });
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + details));
        Object instructions = event.payload().get("instructions");
        if (instructions != null) {
            for (String line : instructions.toString().split("\n")) {
                System.out.println("    " + line);
            }
        }
    }

    public static void result(PromotionResult result) {
        System.out.println("──────────────────────────────────");
        String action = result.action() != null ? result.action().name() : "none";
        String line = "Run " + result.runId() + ": " + result.status() + " (action: " + action + ")";
        switch (result.status()) {
            case COMPLETED -> success(line);
            case NOOP, GATE_CLOSED -> info(line);
            case CONFLICT -> warn(line);
            case FAILED -> error(line + (result.error() != null ? " - " + result.error() : ""));
        }
    }
}
