package com.community.movierating.controller;

import com.community.movierating.dto.CommonResponse;
import com.community.movierating.dto.EngineMetricsDTO;
import com.community.movierating.service.SystemStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probes for load balancers and a small metrics view.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SystemStatusService systemStatusService;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(systemStatusService.health());
    }

    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        boolean reachable = systemStatusService.isDatabaseReachable();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", reachable ? "ready" : "not ready");
        body.put("database", reachable ? "connected" : "disconnected");
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(reachable ? 200 : 503).body(body);
    }

    @GetMapping("/metrics")
    public ResponseEntity<CommonResponse<EngineMetricsDTO>> metrics() {
        return ResponseEntity.ok(CommonResponse.success(systemStatusService.getMetrics()));
    }
}
