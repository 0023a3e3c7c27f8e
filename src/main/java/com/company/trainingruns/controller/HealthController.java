package com.company.trainingruns.controller;

import com.company.trainingruns.config.TrainingRunProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness check the launcher calls before registering a run.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Liveness endpoint for the launcher")
@RequiredArgsConstructor
public class HealthController {

    private final Clock clock;
    private final TrainingRunProperties properties;

    @Value("${spring.application.name:training-run-service}")
    private String serviceName;

    @GetMapping
    @Operation(summary = "Liveness and sync configuration")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("service", serviceName);
        body.put("timestamp", clock.instant());
        body.put("trackerProject", properties.getTracker().getEntity() + "/" + properties.getTracker().getProject());
        body.put("reconciliationEnabled", properties.getReconciliation().isEnabled());
        body.put("hostChecksEnabled", properties.getInfrastructure().isEnabled());
        return ResponseEntity.ok(body);
    }
}
