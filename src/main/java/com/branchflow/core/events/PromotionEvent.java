package com.branchflow.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while processing a branch event, consumed by notification sinks.
 *
 * @param kind      which decision point produced the event
 * @param runId     pipeline execution the event belongs to
 * @param branch    branch whose event is being processed
 * @param payload   kind-specific data, including copy-pasteable instructions where a human must act
 * @param timestamp when the event was emitted
 */
public record PromotionEvent(
    EventKind kind,
    String runId,
    String branch,
    Map<String, Object> payload,
    Instant timestamp
) {

    public String eventType() {
        return kind.eventType();
    }
}
