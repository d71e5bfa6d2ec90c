package com.missioncontrol.dispatch.api;

import com.missioncontrol.core.health.HealthCheckService;
import com.missioncontrol.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Component health of the record store and both realtime transports.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/health: 200 while no component is DOWN, 503 otherwise.
     * A DEGRADED component shows in the body but keeps the overall status UP.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        List<HealthStatus> checks = healthCheckService.checkAll();
        boolean anyDown = checks.stream().anyMatch(c -> c.status() == HealthStatus.Status.DOWN);

        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : checks) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("status", check.status().name());
            info.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                info.put("metadata", check.metadata());
            }
            components.put(check.component(), info);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", anyDown ? "DOWN" : "UP");
        result.put("components", components);
        return anyDown ? ResponseEntity.status(503).body(result) : ResponseEntity.ok(result);
    }
}
