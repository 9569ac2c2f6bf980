package com.branchflow.core.health;

import com.branchflow.core.config.BranchflowProperties;
import com.branchflow.core.events.EventBus;
import com.branchflow.core.events.NotificationDispatcher;
import com.branchflow.core.health.HealthStatus.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.concurrent.TimeUnit;

/**
 * Checks that this host can promote branches: git runs, the configured
 * working tree exists, and notification sinks are registered and delivering.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final BranchflowProperties properties;
    private final NotificationDispatcher notificationDispatcher;
    private final EventBus eventBus;

    public HealthCheckService(BranchflowProperties properties,
                              @Autowired(required = false) NotificationDispatcher notificationDispatcher,
                              @Autowired(required = false) EventBus eventBus) {
        this.properties = properties;
        this.notificationDispatcher = notificationDispatcher;
        this.eventBus = eventBus;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGit());
        results.add(checkRepository());
        results.add(checkNotification());
        return results;
    }

    HealthStatus checkGit() {
        try {
            String version = gitVersion();
            if (version == null) {
                return HealthStatus.down(Component.GIT, "git --version did not succeed",
                        "Check that git runs for the user branchflow runs as", Map.of());
            }
            return HealthStatus.up(Component.GIT, version, Map.of());
        } catch (IOException e) {
            log.warn("Git health check failed: {}", e.getMessage());
            return HealthStatus.down(Component.GIT, "git binary not available: " + e.getMessage(),
                    "Install git and put it on the PATH", Map.of());
        }
    }

    HealthStatus checkRepository() {
        Path path = Path.of(properties.getRepositoryPath()).toAbsolutePath().normalize();
        var metadata = Map.of("path", path.toString(), "remote", properties.getRemote());
        if (!Files.isDirectory(path)) {
            return HealthStatus.down(Component.REPOSITORY, "Repository path does not exist: " + path,
                    "Set branchflow.repository.path (BRANCHFLOW_REPOSITORY_PATH)", metadata);
        }
        // .git is a directory in a clone and a file in a worktree
        if (!Files.exists(path.resolve(".git"))) {
            return HealthStatus.down(Component.REPOSITORY, "Not a git working tree: " + path,
                    "Clone the repository into " + path, metadata);
        }
        return HealthStatus.up(Component.REPOSITORY, "Working tree at " + path, metadata);
    }

    HealthStatus checkNotification() {
        List<String> sinks = notificationDispatcher != null ? notificationDispatcher.sinkNames() : List.of();
        if (sinks.isEmpty()) {
            return HealthStatus.down(Component.NOTIFICATION, "No notification sinks registered",
                    "Promotions still run but nobody is told about tags to create or conflicts to resolve",
                    Map.of());
        }
        var metadata = new LinkedHashMap<String, String>();
        metadata.put("sinks", String.join(",", sinks));

        Map<String, Long> failures = eventBus != null ? eventBus.deliveryFailures() : Map.of();
        if (!failures.isEmpty()) {
            String summary = failures.entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining(","));
            metadata.put("deliveryFailures", summary);
            return HealthStatus.degraded(Component.NOTIFICATION, "Failed deliveries: " + summary,
                    "Check the sink endpoints; failed events are in the run history", metadata);
        }
        if (!properties.isWebhookConfigured()) {
            return HealthStatus.degraded(Component.NOTIFICATION, "Log-only (no webhook configured)",
                    "Set branchflow.notification.webhook-url to reach people outside the logs", metadata);
        }
        return HealthStatus.up(Component.NOTIFICATION, "Sinks: " + String.join(", ", sinks), metadata);
    }

    /**
     * Runs {@code git --version}.
     *
     * @return the version line, or null when git exits non-zero or hangs
     */
    String gitVersion() throws IOException {
        Process process = new ProcessBuilder("git", "--version").redirectErrorStream(true).start();
        try {
            if (!process.waitFor(10, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return null;
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            return process.exitValue() == 0 ? output : null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return null;
        }
    }
}
