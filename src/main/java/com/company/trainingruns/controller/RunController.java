package com.company.trainingruns.controller;

import com.company.trainingruns.domain.RunFilter;
import com.company.trainingruns.domain.RunStats;
import com.company.trainingruns.domain.TrainingRun;
import com.company.trainingruns.domain.enums.RunSortOrder;
import com.company.trainingruns.domain.enums.RunStatus;
import com.company.trainingruns.dto.request.AttachmentRequest;
import com.company.trainingruns.dto.request.CrashReportRequest;
import com.company.trainingruns.dto.request.ObjectiveMetricsRequest;
import com.company.trainingruns.dto.request.RegisterRunRequest;
import com.company.trainingruns.dto.response.ObjectiveResponse;
import com.company.trainingruns.dto.response.RunDetailResponse;
import com.company.trainingruns.dto.response.RunResponse;
import com.company.trainingruns.service.ObjectiveMetricService;
import com.company.trainingruns.service.RunQueryService;
import com.company.trainingruns.service.RunRegistrationService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/runs")
@Tag(name = "Training Runs", description = "Register runs at launch and read their lifecycle state")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class RunController {

    private final RunRegistrationService registrationService;
    private final RunQueryService queryService;
    private final ObjectiveMetricService objectiveMetricService;
    private final MeterRegistry meterRegistry;

    @PostMapping
    @Operation(summary = "Register a training run", description = "Called by the launcher before the job starts")
    @PreAuthorize("hasAnyRole('LAUNCHER', 'ADMIN')")
    public ResponseEntity<RunResponse> registerRun(@Valid @RequestBody RegisterRunRequest request) {
        log.info("Register run request for {} on host {}", request.getRunId(), request.getHost());

        meterRegistry.counter("api.runs.register.requests",
                "host", request.getHost() != null ? request.getHost() : "unknown"
        ).increment();

        TrainingRun run = registrationService.register(request);

        return ResponseEntity
                .created(URI.create("/api/v1/runs/" + run.getRunId()))
                .body(RunQueryService.toRunResponse(run));
    }

    @GetMapping("/{runId}")
    @Operation(summary = "Get a run with its objectives")
    @PreAuthorize("hasAnyRole('ANALYST', 'LAUNCHER', 'ADMIN')")
    public ResponseEntity<RunDetailResponse> getRun(@PathVariable String runId) {
        meterRegistry.counter("api.runs.get.requests").increment();
        return ResponseEntity.ok(queryService.getRunDetail(runId));
    }

    @GetMapping
    @Operation(summary = "List runs", description = "All filters are optional and combine with AND")
    @PreAuthorize("hasAnyRole('ANALYST', 'LAUNCHER', 'ADMIN')")
    public ResponseEntity<List<RunResponse>> listRuns(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String host,
            @RequestParam(required = false) String gradientMethod,
            @Parameter(description = "Minimum run duration in hours")
            @RequestParam(required = false) Double minDurationHours,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdAfter,
            @RequestParam(required = false) Boolean hasBlogPost,
            @RequestParam(required = false) Boolean hasCrashReport,
            @RequestParam(required = false) Boolean hasCrashAnalysis,
            @RequestParam(defaultValue = "CREATED_AT_DESC") String order,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {

        RunFilter filter = RunFilter.builder()
                .status(status != null ? RunStatus.fromDatabase(status) : null)
                .host(host)
                .gradientMethod(gradientMethod)
                .minDurationHours(minDurationHours)
                .createdAfter(createdAfter)
                .hasBlogPost(hasBlogPost)
                .hasCrashReport(hasCrashReport)
                .hasCrashAnalysis(hasCrashAnalysis)
                .build();

        meterRegistry.counter("api.runs.list.requests").increment();

        List<RunResponse> runs = queryService.listRuns(filter,
                RunSortOrder.valueOf(order.toUpperCase(Locale.ROOT)), limit);

        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(15, TimeUnit.SECONDS).cachePrivate())
                .body(runs);
    }

    @GetMapping("/stats")
    @Operation(summary = "Run counts by status and by host")
    @PreAuthorize("hasAnyRole('ANALYST', 'LAUNCHER', 'ADMIN')")
    public ResponseEntity<RunStats> getStats() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(60, TimeUnit.SECONDS).cachePrivate())
                .body(queryService.getStats());
    }

    @PostMapping("/{runId}/crash-report")
    @Operation(summary = "Attach crash artifacts", description = "Stores S3 keys of the error log, crash report and analysis")
    @PreAuthorize("hasAnyRole('LAUNCHER', 'ADMIN')")
    public ResponseEntity<Void> attachCrashReport(@PathVariable String runId,
                                                  @Valid @RequestBody CrashReportRequest request) {
        registrationService.attachCrashReport(runId, request);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{runId}/blog-post")
    @Operation(summary = "Attach a blog post URL")
    @PreAuthorize("hasAnyRole('LAUNCHER', 'ADMIN')")
    public ResponseEntity<Void> attachBlogPost(@PathVariable String runId,
                                               @Valid @RequestBody AttachmentRequest request) {
        registrationService.attachBlogPost(runId, request.getValue());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{runId}/conversation")
    @Operation(summary = "Attach the S3 key of the launch conversation")
    @PreAuthorize("hasAnyRole('LAUNCHER', 'ADMIN')")
    public ResponseEntity<Void> attachConversation(@PathVariable String runId,
                                                   @Valid @RequestBody AttachmentRequest request) {
        registrationService.attachConversation(runId, request.getValue());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{runId}/objectives")
    @Operation(summary = "List a run's objectives")
    @PreAuthorize("hasAnyRole('ANALYST', 'LAUNCHER', 'ADMIN')")
    public ResponseEntity<List<ObjectiveResponse>> getObjectives(@PathVariable String runId) {
        List<ObjectiveResponse> objectives = objectiveMetricService.getObjectives(runId).stream()
                .map(RunQueryService::toObjectiveResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(objectives);
    }

    @PutMapping("/{runId}/objectives/{objectiveName}/metrics")
    @Operation(summary = "Write objective metric values", description = "Fields left null are not changed")
    @PreAuthorize("hasAnyRole('LAUNCHER', 'ADMIN')")
    public ResponseEntity<ObjectiveResponse> updateObjectiveMetrics(
            @PathVariable String runId,
            @PathVariable String objectiveName,
            @Valid @RequestBody ObjectiveMetricsRequest request) {

        meterRegistry.counter("api.objectives.metrics.requests").increment();

        return ResponseEntity.ok(RunQueryService.toObjectiveResponse(
                objectiveMetricService.updateMetrics(runId, objectiveName, request)));
    }
}
