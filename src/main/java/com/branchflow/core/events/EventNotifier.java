package com.branchflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emits one {@link PromotionEvent} per decision point.
 *
 * <p>Events are published synchronously, so by the time {@link #emit} returns
 * every subscriber (notification sinks, run history) has seen the event.
 * Nothing is batched or deduplicated.
 */
@Service
public class EventNotifier {

    private static final Logger log = LoggerFactory.getLogger(EventNotifier.class);

    private final EventBus eventBus;
    private final Clock clock;

    public EventNotifier(EventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Emits an event for a run.
     *
     * @throws IllegalArgumentException if the payload misses a key the kind requires
     */
    public PromotionEvent emit(String runId, String branch, EventKind kind, Map<String, Object> payload) {
        for (String key : kind.requiredKeys()) {
            if (!payload.containsKey(key) || payload.get(key) == null) {
                throw new IllegalArgumentException("Event " + kind + " requires payload key '" + key + "'");
            }
        }

        var event = new PromotionEvent(kind, runId, branch,
                Collections.unmodifiableMap(new LinkedHashMap<>(payload)), clock.instant());
        log.info("Event {} for {}: {}", kind.eventType(), branch, payload.keySet());
        eventBus.publish(event);
        return event;
    }
}
