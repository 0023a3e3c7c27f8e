package com.company.trainingruns.controller;

import com.company.trainingruns.domain.GradientMethodComparison;
import com.company.trainingruns.domain.ObjectiveStatistics;
import com.company.trainingruns.domain.enums.RunStatus;
import com.company.trainingruns.dto.request.ObjectiveQueryRequest;
import com.company.trainingruns.dto.response.RunResponse;
import com.company.trainingruns.service.ObjectiveQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/objectives")
@Tag(name = "Objective Analysis", description = "Cross-run queries over objective metrics")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class ObjectiveQueryController {

    private final ObjectiveQueryService queryService;
    private final MeterRegistry meterRegistry;

    @PostMapping("/query")
    @Operation(
            summary = "Find runs by objective bounds",
            description = "Returns runs that satisfy every objective bound at once, each run at most once"
    )
    @PreAuthorize("hasAnyRole('ANALYST', 'ADMIN')")
    public ResponseEntity<List<RunResponse>> query(@Valid @RequestBody ObjectiveQueryRequest request) {
        meterRegistry.counter("api.objectives.query.requests",
                "objectives", String.valueOf(request.getObjectives() != null ? request.getObjectives().size() : 0)
        ).increment();

        return ResponseEntity.ok(queryService.query(queryService.toQuery(request)));
    }

    @GetMapping("/{objectiveName}/statistics")
    @Operation(summary = "Aggregate raw_mean statistics for one objective")
    @PreAuthorize("hasAnyRole('ANALYST', 'ADMIN')")
    public ResponseEntity<ObjectiveStatistics> getStatistics(
            @PathVariable String objectiveName,
            @RequestParam(required = false) String gradientMethod,
            @Parameter(description = "Run status filter, not_running if omitted; 'any' disables it")
            @RequestParam(defaultValue = "not_running") String status) {

        meterRegistry.counter("api.objectives.statistics.requests").increment();

        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(60, TimeUnit.SECONDS).cachePrivate())
                .body(queryService.getStatistics(objectiveName, gradientMethod, parseStatus(status)));
    }

    @GetMapping("/{objectiveName}/gradient-methods")
    @Operation(summary = "Compare gradient methods on one objective", description = "Best average first")
    @PreAuthorize("hasAnyRole('ANALYST', 'ADMIN')")
    public ResponseEntity<List<GradientMethodComparison>> compareGradientMethods(
            @PathVariable String objectiveName,
            @RequestParam(defaultValue = "not_running") String status) {

        meterRegistry.counter("api.objectives.compare.requests").increment();

        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(60, TimeUnit.SECONDS).cachePrivate())
                .body(queryService.compareGradientMethods(objectiveName, parseStatus(status)));
    }

    private static RunStatus parseStatus(String status) {
        return "any".equalsIgnoreCase(status) ? null : RunStatus.fromDatabase(status);
    }
}
