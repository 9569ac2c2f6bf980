package com.branchflow.core.model;

import com.branchflow.core.events.PromotionEvent;

import java.util.List;

/**
 * What happened for one branch event.
 *
 * @param runId      pipeline execution identifier
 * @param descriptor classified branch, parent release resolved for hotfixes
 * @param action     the action selected, or null when the event stopped before selection
 * @param status     terminal status
 * @param events     events emitted for this run, in emission order
 * @param error      failure message when {@code status} is FAILED, otherwise null
 */
public record PromotionResult(
    String runId,
    BranchDescriptor descriptor,
    PromotionAction action,
    PromotionStatus status,
    List<PromotionEvent> events,
    String error
) {

    public PromotionResult {
        events = List.copyOf(events);
    }

    public int exitCode() {
        return status.exitCode();
    }
}
