package com.branchflow.core.events;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Subscribes every {@link NotificationSink} bean to the {@link EventBus}.
 */
@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final EventBus eventBus;
    private final List<NotificationSink> sinks;
    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();

    public NotificationDispatcher(EventBus eventBus, List<NotificationSink> sinks) {
        this.eventBus = eventBus;
        this.sinks = List.copyOf(sinks);
    }

    @PostConstruct
    void start() {
        for (NotificationSink sink : sinks) {
            subscriptions.add(eventBus.subscribeAll(sink.name(), sink::deliver));
            log.info("Notification sink '{}' registered", sink.name());
        }
    }

    @PreDestroy
    void stop() {
        subscriptions.forEach(EventBus.Subscription::unsubscribe);
        subscriptions.clear();
    }

    public List<String> sinkNames() {
        return sinks.stream().map(NotificationSink::name).toList();
    }
}
