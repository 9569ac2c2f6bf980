package com.branchflow.core.events;

import java.util.List;

/**
 * Catalogue of events emitted at promotion decision points, with the payload
 * keys each one must carry.
 */
public enum EventKind {
    TAG_REMINDER("tag.reminder", "branchKind", "branchName", "tagCommandText"),
    RELEASE_CREATED("release.created", "fromDev", "newRelease"),
    RELEASE_DEPLOYED("release.deployed", "releaseBranch", "tagName"),
    AWAITING_RELEASE_COMPLETION("release.awaiting_completion", "parentRelease"),
    HOTFIX_PROPAGATED("hotfix.propagated", "targetDev"),
    CONFLICT_DETECTED("hotfix.conflict_detected", "report"),
    PROPAGATION_FAILED("hotfix.propagation_failed", "targetDev", "error"),
    PROMOTION_FAILED("promotion.failed", "branchName", "operation", "error");

    private final String eventType;
    private final List<String> requiredKeys;

    EventKind(String eventType, String... requiredKeys) {
        this.eventType = eventType;
        this.requiredKeys = List.of(requiredKeys);
    }

    /** Dotted wire name, e.g. {@code release.created}. */
    public String eventType() {
        return eventType;
    }

    public List<String> requiredKeys() {
        return requiredKeys;
    }
}
