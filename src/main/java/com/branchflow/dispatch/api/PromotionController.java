package com.branchflow.dispatch.api;

import com.branchflow.core.engine.PromotionService;
import com.branchflow.core.events.RunHistory;
import com.branchflow.core.model.PromotionResult;
import com.branchflow.core.model.PromotionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for branch events posted by CI.
 */
@RestController
@RequestMapping("/api/v1/promotions")
public class PromotionController {

    private static final Logger log = LoggerFactory.getLogger(PromotionController.class);

    private final PromotionService promotionService;
    private final RunHistory runHistory;

    public PromotionController(PromotionService promotionService, RunHistory runHistory) {
        this.promotionService = promotionService;
        this.runHistory = runHistory;
    }

    /**
     * POST /api/v1/promotions: Process a branch event synchronously.
     * Returns 500 when the run failed, 200 otherwise (conflicts included).
     */
    @PostMapping
    public ResponseEntity<?> promote(@RequestBody PromotionRequest request) {
        if (request == null || request.branch() == null || request.branch().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Branch is required"));
        }
        log.info("Branch event received for '{}' (run {})", request.branch(), request.runId());
        PromotionResult result = promotionService.promote(request.branch(), request.runId());
        PromotionResponse body = PromotionResponse.from(result);
        return result.status() == PromotionStatus.FAILED
                ? ResponseEntity.status(500).body(body)
                : ResponseEntity.ok(body);
    }

    /**
     * POST /api/v1/promotions/plan: The action a branch event would take; read-only.
     */
    @PostMapping("/plan")
    public ResponseEntity<?> plan(@RequestBody PromotionRequest request) {
        if (request == null || request.branch() == null || request.branch().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Branch is required"));
        }
        PromotionResult plan = promotionService.plan(request.branch());
        PromotionResponse body = PromotionResponse.from(plan);
        return plan.status() == PromotionStatus.FAILED
                ? ResponseEntity.status(500).body(body)
                : ResponseEntity.ok(body);
    }

    /**
     * GET /api/v1/promotions/{runId}: Events recorded for a recent run.
     */
    @GetMapping("/{runId}")
    public ResponseEntity<Map<String, Object>> getRun(@PathVariable String runId) {
        return runHistory.eventsFor(runId)
                .<ResponseEntity<Map<String, Object>>>map(events -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("run_id", runId);
                    body.put("events", PromotionResponse.events(events));
                    return ResponseEntity.ok(body);
                })
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of("error", "Run not found: " + runId)));
    }
}
