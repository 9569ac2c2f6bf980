package com.branchflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every event to the log, instructions included.
 */
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void deliver(PromotionEvent event) {
        Object instructions = event.payload().get("instructions");
        switch (event.kind()) {
            case CONFLICT_DETECTED, PROPAGATION_FAILED, PROMOTION_FAILED ->
                    log.warn("[{}] {} {} {}", event.runId(), event.eventType(), event.branch(), event.payload());
            default ->
                    log.info("[{}] {} {} {}", event.runId(), event.eventType(), event.branch(), event.payload());
        }
        if (instructions != null) {
            log.info("[{}] next steps:\n{}", event.runId(), instructions);
        }
    }
}
