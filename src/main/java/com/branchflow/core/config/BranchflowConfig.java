package com.branchflow.core.config;

import com.branchflow.core.events.LoggingNotificationSink;
import com.branchflow.core.events.NotificationSink;
import com.branchflow.core.events.WebhookNotificationSink;
import com.branchflow.core.gateway.VcsGateway;
import com.branchflow.core.gateway.git.GitCliGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class BranchflowConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Gateway over the configured working tree. The working tree must already
     * be a clone with {@code branchflow.repository.remote} pointing at the
     * shared repository.
     */
    @Bean
    @ConditionalOnMissingBean(VcsGateway.class)
    public VcsGateway vcsGateway(BranchflowProperties properties) {
        return new GitCliGateway(
                Path.of(properties.getRepositoryPath()).toAbsolutePath().normalize(),
                properties.getRemote(),
                properties.getAuthorName(),
                properties.getAuthorEmail());
    }

    @Bean
    public NotificationSink loggingNotificationSink() {
        return new LoggingNotificationSink();
    }

    @Bean
    @ConditionalOnExpression("'${branchflow.notification.webhook-url:}' != ''")
    public NotificationSink webhookNotificationSink(BranchflowProperties properties, ObjectMapper objectMapper) {
        return new WebhookNotificationSink(
                properties.getNotification().getWebhookUrl(),
                Duration.ofSeconds(properties.getNotification().getTimeoutSeconds()),
                objectMapper);
    }
}
