package com.branchflow.dispatch.api;

import com.branchflow.core.health.HealthCheckService;
import com.branchflow.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for promotion readiness.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 503 when git or the working tree is DOWN, since no
     * promotion can run; otherwise 200 with an overall UP or DEGRADED.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        List<HealthStatus> checks = healthCheckService.checkAll();
        boolean blocked = checks.stream().anyMatch(HealthStatus::blocksPromotion);
        boolean allUp = checks.stream().allMatch(c -> c.status() == HealthStatus.Status.UP);

        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : checks) {
            Map<String, Object> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            componentInfo.put("requiredToPromote", check.component().requiredToPromote());
            if (check.remedy() != null) {
                componentInfo.put("remedy", check.remedy());
            }
            if (!check.metadata().isEmpty()) {
                componentInfo.put("metadata", check.metadata());
            }
            components.put(check.component().key(), componentInfo);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", blocked ? "DOWN" : allUp ? "UP" : "DEGRADED");
        result.put("canPromote", !blocked);
        result.put("components", components);

        return blocked ? ResponseEntity.status(503).body(result)
                       : ResponseEntity.ok(result);
    }
}
