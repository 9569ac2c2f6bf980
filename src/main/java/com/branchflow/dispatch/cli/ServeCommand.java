package com.branchflow.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: branchflow serve
 * <p>
 * Starts Branchflow as a long-running HTTP server so CI systems can post
 * branch events. The web server is enabled by
 * {@link com.branchflow.BranchflowApplication#main} detecting "serve" in args,
 * and {@link CliRunner} skips picocli in that mode.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 branchflow serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Branchflow HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Branchflow server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/promotions");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
