package com.branchflow.core.events;

/**
 * Thrown by a {@link NotificationSink} that could not hand an event to its
 * destination. The {@link EventBus} logs and counts it; the promotion carries on.
 */
public class NotificationDeliveryException extends RuntimeException {

    private final String sink;

    public NotificationDeliveryException(String sink, String message) {
        super(message);
        this.sink = sink;
    }

    public NotificationDeliveryException(String sink, String message, Throwable cause) {
        super(message, cause);
        this.sink = sink;
    }

    public String sink() {
        return sink;
    }
}
