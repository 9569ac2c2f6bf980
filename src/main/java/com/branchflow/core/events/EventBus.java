package com.branchflow.core.events;

import com.branchflow.core.metrics.BranchflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;

/**
 * Delivers promotion events to named subscribers: notification sinks and run
 * history for every run, and the collector of a single run while it executes.
 * <p>
 * Delivery is synchronous and in publish order. A subscriber that throws does
 * not stop delivery to the others; the failure is logged, counted against the
 * subscriber's name and reported through {@link #deliveryFailures()} so the
 * health check can flag a sink that keeps dropping notifications.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final BranchflowMetrics metrics;

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Subscriber>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Subscriber> globalSubscribers = new CopyOnWriteArrayList<>();

    private final ConcurrentHashMap<String, LongAdder> failures = new ConcurrentHashMap<>();

    public EventBus() {
        this(null);
    }

    @Autowired
    public EventBus(BranchflowMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Delivers an event to the subscribers of its run, then to the global ones.
     *
     * @return names of the subscribers that failed to take the event, empty when all did
     */
    public List<String> publish(PromotionEvent event) {
        log.debug("Publishing {} for run {}", event.eventType(), event.runId());
        var failed = new CopyOnWriteArrayList<String>();

        List<Subscriber> forRun = runSubscribers.get(event.runId());
        if (forRun != null) {
            forRun.forEach(subscriber -> deliver(subscriber, event, failed));
        }
        globalSubscribers.forEach(subscriber -> deliver(subscriber, event, failed));
        return List.copyOf(failed);
    }

    /**
     * Collects the events of one run until the returned subscription is closed.
     */
    public Subscription subscribe(String runId, Consumer<PromotionEvent> consumer) {
        var subscriber = new Subscriber("run " + runId, consumer);
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        return () -> runSubscribers.computeIfPresent(runId, (k, subs) -> {
            subs.remove(subscriber);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Registers a subscriber for the events of every run.
     *
     * @param name identifies the subscriber in logs, metrics and health output
     */
    public Subscription subscribeAll(String name, Consumer<PromotionEvent> consumer) {
        var subscriber = new Subscriber(name, consumer);
        globalSubscribers.add(subscriber);
        log.debug("Subscriber '{}' receives all runs", name);
        return () -> globalSubscribers.remove(subscriber);
    }

    /**
     * Failed deliveries since startup, by subscriber name. Subscribers that
     * never failed are absent.
     */
    public Map<String, Long> deliveryFailures() {
        var snapshot = new LinkedHashMap<String, Long>();
        failures.forEach((name, count) -> snapshot.put(name, count.sum()));
        return snapshot;
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private record Subscriber(String name, Consumer<PromotionEvent> consumer) {
    }

    private void deliver(Subscriber subscriber, PromotionEvent event, List<String> failed) {
        try {
            subscriber.consumer().accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber '{}' failed to take {} for run {}: {}",
                    subscriber.name(), event.eventType(), event.runId(), e.getMessage(), e);
            failures.computeIfAbsent(subscriber.name(), k -> new LongAdder()).increment();
            failed.add(subscriber.name());
            if (metrics != null) {
                metrics.recordDeliveryFailure(subscriber.name(), event.kind());
            }
        }
    }
}
