package com.company.trainingruns.controller;

import com.company.trainingruns.config.TrainingRunProperties;
import com.company.trainingruns.reconciliation.OrphanedRunDetector;
import com.company.trainingruns.reconciliation.ReconciliationOptions;
import com.company.trainingruns.reconciliation.ReconciliationSummary;
import com.company.trainingruns.reconciliation.RunReconciliationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * On-demand reconciliation, for operators who cannot wait for the next scheduled pass.
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@Tag(name = "Reconciliation", description = "Trigger tracker and host reconciliation")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class ReconciliationController {

    private final RunReconciliationService reconciliationService;
    private final ObjectProvider<OrphanedRunDetector> orphanedRunDetector;
    private final TrainingRunProperties properties;

    @PostMapping("/run")
    @Operation(summary = "Reconcile runs against the tracker")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ReconciliationSummary> reconcile(
            @RequestParam(required = false) @Min(1) @Max(10000) Integer limit,
            @RequestParam(defaultValue = "false") boolean dryRun,
            @RequestParam(required = false) Boolean markStale) {

        ReconciliationOptions options = ReconciliationOptions.defaults(properties);
        if (limit != null) {
            options.setLimit(limit);
        }
        if (markStale != null) {
            options.setMarkStale(markStale);
        }
        options.setDryRun(dryRun);

        log.info("Manual reconciliation requested: {}", options);
        return ResponseEntity.ok(reconciliationService.reconcile(options));
    }

    @PostMapping("/orphans")
    @Operation(summary = "Stop runs whose compute host is gone")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ReconciliationSummary> detectOrphans(
            @RequestParam(required = false) @Min(1) @Max(10000) Integer limit,
            @RequestParam(defaultValue = "false") boolean dryRun) {

        OrphanedRunDetector detector = orphanedRunDetector.getIfAvailable();
        if (detector == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }

        ReconciliationOptions options = ReconciliationOptions.builder()
                .limit(limit != null ? limit : properties.getInfrastructure().getBatchLimit())
                .dryRun(dryRun)
                .build();

        log.info("Manual orphan detection requested: {}", options);
        return ResponseEntity.ok(detector.detectOrphans(options));
    }
}
