package com.branchflow.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/promotions and /api/v1/promotions/plan.
 *
 * @param branch branch the event is about
 * @param runId  pipeline execution id; nullable, a generated id is used when absent
 */
public record PromotionRequest(
    String branch,
    @JsonProperty("run_id") String runId
) {}
