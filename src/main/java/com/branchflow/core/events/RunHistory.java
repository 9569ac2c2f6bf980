package com.branchflow.core.events;

import com.branchflow.core.config.BranchflowProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the events of recent runs in memory, oldest run evicted first.
 */
@Component
public class RunHistory {

    private final int maxRuns;
    private final Map<String, List<PromotionEvent>> runs;

    public RunHistory(EventBus eventBus, BranchflowProperties properties) {
        this.maxRuns = Math.max(1, properties.getHistory().getMaxRuns());
        this.runs = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<PromotionEvent>> eldest) {
                return size() > maxRuns;
            }
        };
        eventBus.subscribeAll("run-history", this::record);
    }

    synchronized void record(PromotionEvent event) {
        runs.computeIfAbsent(event.runId(), k -> new ArrayList<>()).add(event);
    }

    public synchronized Optional<List<PromotionEvent>> eventsFor(String runId) {
        List<PromotionEvent> events = runs.get(runId);
        return events == null ? Optional.empty() : Optional.of(List.copyOf(events));
    }

    public synchronized List<String> runIds() {
        return List.copyOf(runs.keySet());
    }
}
