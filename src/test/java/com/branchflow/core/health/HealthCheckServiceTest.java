package com.branchflow.core.health;

import com.branchflow.core.config.BranchflowProperties;
import com.branchflow.core.events.EventBus;
import com.branchflow.core.events.EventKind;
import com.branchflow.core.events.LoggingNotificationSink;
import com.branchflow.core.events.NotificationDeliveryException;
import com.branchflow.core.events.NotificationDispatcher;
import com.branchflow.core.events.PromotionEvent;
import com.branchflow.core.health.HealthStatus.Component;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckServiceTest {

    @TempDir
    Path workDir;

    private BranchflowProperties properties;
    private EventBus eventBus;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        properties = new BranchflowProperties();
        properties.getRepository().setPath(workDir.toString());
        eventBus = new EventBus();
        dispatcher = new NotificationDispatcher(eventBus, List.of(new LoggingNotificationSink()));
    }

    private HealthCheckService serviceWithGit(String version) {
        return new HealthCheckService(properties, dispatcher, eventBus) {
            @Override
            String gitVersion() {
                return version;
            }
        };
    }

    @Test
    @DisplayName("checkAll reports git, repository and notification in order")
    void checkAll() {
        var results = serviceWithGit("git version 2.45.0").checkAll();
        assertEquals(List.of(Component.GIT, Component.REPOSITORY, Component.NOTIFICATION),
                results.stream().map(HealthStatus::component).toList());
    }

    @Test
    @DisplayName("git UP with its version")
    void gitUp() {
        var status = serviceWithGit("git version 2.45.0").checkGit();
        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("git version 2.45.0", status.detail());
    }

    @Test
    @DisplayName("git DOWN when the binary cannot run")
    void gitMissing() {
        var service = new HealthCheckService(properties, dispatcher, eventBus) {
            @Override
            String gitVersion() throws IOException {
                throw new IOException("Cannot run program \"git\"");
            }
        };
        var status = service.checkGit();
        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertTrue(status.blocksPromotion());
        assertEquals("Install git and put it on the PATH", status.remedy());
    }

    @Test
    @DisplayName("repository DOWN when the path is not a working tree")
    void notAWorkingTree() {
        var status = serviceWithGit("v").checkRepository();
        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertTrue(status.detail().contains("Not a git working tree"));
    }

    @Test
    @DisplayName("repository UP when .git exists")
    void workingTree() throws IOException {
        Files.createDirectory(workDir.resolve(".git"));
        var status = serviceWithGit("v").checkRepository();
        assertEquals(HealthStatus.Status.UP, status.status());
        assertNull(status.remedy());
        assertEquals("origin", status.metadata().get("remote"));
    }

    @Test
    @DisplayName("repository DOWN when the path is missing")
    void missingPath() {
        properties.getRepository().setPath(workDir.resolve("nope").toString());
        assertEquals(HealthStatus.Status.DOWN, serviceWithGit("v").checkRepository().status());
    }

    @Test
    @DisplayName("notification DEGRADED when only logging")
    void logOnly() {
        assertEquals(HealthStatus.Status.DEGRADED, serviceWithGit("v").checkNotification().status());
    }

    @Test
    @DisplayName("notification UP with a webhook configured")
    void webhook() {
        properties.getNotification().setWebhookUrl("https://chat.example.com/hook");
        assertEquals(HealthStatus.Status.UP, serviceWithGit("v").checkNotification().status());
    }

    @Test
    @DisplayName("notification DOWN without a dispatcher")
    void noDispatcher() {
        var status = new HealthCheckService(properties, null, null).checkNotification();
        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertFalse(status.blocksPromotion());
    }

    @Test
    @DisplayName("notification DEGRADED with counts when a sink keeps failing")
    void failingSink() {
        properties.getNotification().setWebhookUrl("https://chat.example.com/hook");
        eventBus.subscribeAll("webhook", e -> {
            throw new NotificationDeliveryException("webhook", "HTTP 502");
        });
        var event = new PromotionEvent(EventKind.TAG_REMINDER, "run-1", "d7", Map.of(), Instant.EPOCH);
        eventBus.publish(event);
        eventBus.publish(event);

        var status = serviceWithGit("v").checkNotification();

        assertEquals(HealthStatus.Status.DEGRADED, status.status());
        assertEquals("Failed deliveries: webhook=2", status.detail());
        assertEquals("webhook=2", status.metadata().get("deliveryFailures"));
        assertNotNull(status.remedy());
    }
}
