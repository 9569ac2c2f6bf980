package com.branchflow.dispatch.api;

import com.branchflow.core.events.PromotionEvent;
import com.branchflow.core.model.PromotionResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON response for promotion endpoints.
 */
public record PromotionResponse(
    @JsonProperty("run_id") String runId,
    String branch,
    String kind,
    @JsonProperty("parent_release") String parentRelease,
    String action,
    @JsonProperty("action_detail") String actionDetail,
    String status,
    @JsonProperty("exit_code") int exitCode,
    String error,
    List<EventResponse> events
) {

    public record EventResponse(
        String event,
        @JsonProperty("run_id") String runId,
        String branch,
        Instant timestamp,
        Map<String, Object> payload
    ) {
        static EventResponse from(PromotionEvent event) {
            return new EventResponse(event.eventType(), event.runId(), event.branch(),
                    event.timestamp(), event.payload());
        }
    }

    static PromotionResponse from(PromotionResult result) {
        var d = result.descriptor();
        return new PromotionResponse(
                result.runId(),
                d.rawName(),
                d.kind().name(),
                d.hasParentRelease() ? d.parentReleaseBranch() : null,
                result.action() != null ? result.action().name() : null,
                result.action() != null ? result.action().toString() : null,
                result.status().name(),
                result.exitCode(),
                result.error(),
                events(result.events()));
    }

    static List<EventResponse> events(List<PromotionEvent> events) {
        return events.stream().map(EventResponse::from).toList();
    }
}
