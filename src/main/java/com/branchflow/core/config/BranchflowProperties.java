package com.branchflow.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "branchflow")
public class BranchflowProperties {

    private Repository repository = new Repository();
    private Notification notification = new Notification();
    private History history = new History();

    // -- Repository accessors (delegate to nested) --
    public String getRepositoryPath() { return repository.path; }
    public String getRemote() { return repository.remote; }
    public String getMasterBranch() { return repository.masterBranch; }
    public String getAuthorName() { return repository.authorName; }
    public String getAuthorEmail() { return repository.authorEmail; }

    /**
     * Returns true when a webhook URL has been configured for notifications.
     * When false, events are only written to the log.
     */
    public boolean isWebhookConfigured() {
        return notification.webhookUrl != null && !notification.webhookUrl.isBlank();
    }

    public Repository getRepository() { return repository; }
    public void setRepository(Repository repository) { this.repository = repository; }
    public Notification getNotification() { return notification; }
    public void setNotification(Notification notification) { this.notification = notification; }
    public History getHistory() { return history; }
    public void setHistory(History history) { this.history = history; }

    public static class Repository {
        private String path = ".";
        private String remote = "origin";
        private String masterBranch = "master";
        private String authorName = "Branchflow";
        private String authorEmail = "branchflow@localhost";

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public String getRemote() { return remote; }
        public void setRemote(String remote) { this.remote = remote; }
        public String getMasterBranch() { return masterBranch; }
        public void setMasterBranch(String masterBranch) { this.masterBranch = masterBranch; }
        public String getAuthorName() { return authorName; }
        public void setAuthorName(String authorName) { this.authorName = authorName; }
        public String getAuthorEmail() { return authorEmail; }
        public void setAuthorEmail(String authorEmail) { this.authorEmail = authorEmail; }
    }

    public static class Notification {
        private String webhookUrl = "";
        private int timeoutSeconds = 10;

        public String getWebhookUrl() { return webhookUrl; }
        public void setWebhookUrl(String webhookUrl) { this.webhookUrl = webhookUrl; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class History {
        private int maxRuns = 200;

        public int getMaxRuns() { return maxRuns; }
        public void setMaxRuns(int maxRuns) { this.maxRuns = maxRuns; }
    }
}
