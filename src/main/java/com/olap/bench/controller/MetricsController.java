package com.olap.bench.controller;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.olap.bench.config.BenchProperties;
import com.olap.bench.service.BenchmarkService;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Metrics and health endpoints.
 *
 * Endpoints:
 * - GET /api/metrics: Prometheus text format
 * - GET /api/health: engine reachability and memory usage
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Metrics & Health", description = "Observability and monitoring endpoints")
public class MetricsController {

    private final MeterRegistry meterRegistry;
    private final BenchmarkService benchmarkService;
    private final BenchProperties properties;

    /**
     * Exposes metrics in Prometheus format.
     *
     * Scrape config:
     * <pre>
     * scrape_configs:
     *   - job_name: 'olap-bench'
     *     static_configs:
     *       - targets: ['localhost:8000']
     *     metrics_path: '/api/metrics'
     * </pre>
     */
    @GetMapping(value = "/metrics", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Get Prometheus metrics",
               description = "Returns all application metrics in Prometheus text format")
    public ResponseEntity<String> getPrometheusMetrics() {
        log.debug("Metrics endpoint accessed");

        if (meterRegistry instanceof PrometheusMeterRegistry) {
            PrometheusMeterRegistry prometheusRegistry = (PrometheusMeterRegistry) meterRegistry;
            return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(prometheusRegistry.scrape());
        }

        log.warn("MeterRegistry is not a PrometheusMeterRegistry, returning empty metrics");
        return ResponseEntity.ok()
            .contentType(MediaType.TEXT_PLAIN)
            .body("# Prometheus metrics not available\n");
    }

    /**
     * Health of the service.
     *
     * HTTP 200 when the engine answers its version endpoint, 503 otherwise.
     * <pre>
     * {
     *   "status": "UP",
     *   "components": {
     *     "engine": { "status": "UP", "details": { "address": "localhost:10101", "version": "v0.7.0" } },
     *     "memory": { "status": "UP", "details": { "used": "120.3 MB", ... } }
     *   }
     * }
     * </pre>
     */
    @GetMapping("/health")
    @Operation(summary = "Get application health",
               description = "Engine reachability and memory usage")
    public ResponseEntity<HealthResponse> getHealth() {
        log.debug("Health check endpoint accessed");

        HealthResponse response = new HealthResponse();
        response.status = "UP";
        response.components = new HashMap<>();

        HealthComponent engineHealth = checkEngineHealth();
        response.components.put("engine", engineHealth);
        if (!"UP".equals(engineHealth.status)) {
            response.status = "DOWN";
        }

        response.components.put("memory", checkMemoryHealth());

        if ("UP".equals(response.status)) {
            return ResponseEntity.ok(response);
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    private HealthComponent checkEngineHealth() {
        HealthComponent health = new HealthComponent();
        health.details = new HashMap<>();
        health.details.put("address", properties.getEngine().getAddress());
        health.details.put("index", properties.getEngine().getIndex());

        Optional<String> version = benchmarkService.engineVersion();
        if (version.isPresent()) {
            health.status = "UP";
            health.details.put("version", version.get());
        } else {
            health.status = "DOWN";
            health.details.put("error", "Engine did not report a version");
        }
        return health;
    }

    private HealthComponent checkMemoryHealth() {
        HealthComponent health = new HealthComponent();
        health.status = "UP";
        health.details = new HashMap<>();

        Runtime runtime = Runtime.getRuntime();
        long maxMemory = runtime.maxMemory();
        long usedMemory = runtime.totalMemory() - runtime.freeMemory();
        double usagePercent = (usedMemory * 100.0) / maxMemory;

        health.details.put("used", formatBytes(usedMemory));
        health.details.put("max", formatBytes(maxMemory));
        health.details.put("usage_percent", String.format("%.1f%%", usagePercent));

        // Unbounded result queues grow with a slow reader
        if (usagePercent > 90) {
            health.status = "DEGRADED";
            health.details.put("warning", "Memory usage above 90%");
        }

        return health;
    }

    private String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        int exp = (int) (Math.log(bytes) / Math.log(1024));
        return String.format("%.1f %sB", bytes / Math.pow(1024, exp), "KMGTPE".charAt(exp - 1));
    }

    // =========================================================================
    // Response DTOs
    // =========================================================================

    public static class HealthResponse {
        public String status;
        public Map<String, HealthComponent> components;
    }

    public static class HealthComponent {
        public String status;
        public Map<String, Object> details;
    }
}
