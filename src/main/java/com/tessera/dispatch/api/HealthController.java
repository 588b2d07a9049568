package com.tessera.dispatch.api;

import com.tessera.core.health.HealthCheckService;
import com.tessera.core.health.HealthStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * REST controller for component health.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 503 only when executions cannot run (no reasoning backend).
     * A missing sandbox, git or knowledge server reports DEGRADED with 200.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        List<HealthStatus> checks = healthCheckService.checkAll();
        HealthStatus.Status overall = HealthStatus.overall(checks);

        Map<String, Object> components = new LinkedHashMap<>();
        checks.forEach(check -> components.put(check.component(), describe(check)));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", overall.name());
        body.put("components", components);
        HttpStatus http = overall == HealthStatus.Status.DOWN ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(http).body(body);
    }

    @GetMapping("/{component}")
    public Map<String, Object> component(@PathVariable String component) {
        return healthCheckService.checkAll().stream()
                .filter(check -> check.component().equals(component))
                .findFirst()
                .map(HealthController::describe)
                .orElseThrow(() -> new NoSuchElementException("No health check named " + component));
    }

    private static Map<String, Object> describe(HealthStatus check) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("status", check.status().name());
        info.put("detail", check.detail());
        if (!check.metadata().isEmpty()) {
            info.put("metadata", check.metadata());
        }
        return info;
    }
}
