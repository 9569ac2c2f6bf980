package com.branchflow.core.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts each event as JSON to a chat or mail relay webhook.
 *
 * <p>A POST that fails or is answered with a non-2xx status raises
 * {@link NotificationDeliveryException}; the bus counts it and the promotion
 * carries on. Body shape:
 * <pre>
 * {"event": "release.created", "runId": "...", "branch": "d7",
 *  "timestamp": "...", "payload": {...}}
 * </pre>
 */
public class WebhookNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationSink.class);

    private final URI webhookUri;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public WebhookNotificationSink(String webhookUrl, Duration timeout, ObjectMapper objectMapper) {
        this(URI.create(webhookUrl), timeout, objectMapper,
                HttpClient.newBuilder().connectTimeout(timeout).build());
    }

    WebhookNotificationSink(URI webhookUri, Duration timeout, ObjectMapper objectMapper, HttpClient httpClient) {
        this.webhookUri = webhookUri;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public void deliver(PromotionEvent event) {
        String body;
        try {
            body = toJson(event);
        } catch (JsonProcessingException e) {
            throw new NotificationDeliveryException(name(),
                    "Could not serialize event " + event.eventType() + ": " + e.getOriginalMessage(), e);
        }

        var request = HttpRequest.newBuilder()
                .uri(webhookUri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 300) {
                throw new NotificationDeliveryException(name(),
                        "Webhook returned HTTP " + response.statusCode() + " for " + event.eventType());
            }
            log.debug("Delivered {} to webhook", event.eventType());
        } catch (IOException e) {
            throw new NotificationDeliveryException(name(),
                    "Webhook delivery of " + event.eventType() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Webhook delivery of {} interrupted", event.eventType());
        }
    }

    String toJson(PromotionEvent event) throws JsonProcessingException {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("event", event.eventType());
        node.put("runId", event.runId());
        node.put("branch", event.branch());
        node.put("timestamp", event.timestamp().toString());
        node.set("payload", objectMapper.valueToTree(event.payload()));
        return objectMapper.writeValueAsString(node);
    }

    public URI webhookUri() {
        return webhookUri;
    }
}
