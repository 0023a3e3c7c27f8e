package com.company.trainingruns.scheduled;

import com.company.trainingruns.config.TrainingRunProperties;
import com.company.trainingruns.reconciliation.OrphanedRunDetector;
import com.company.trainingruns.reconciliation.ReconciliationOptions;
import com.company.trainingruns.reconciliation.ReconciliationSummary;
import com.company.trainingruns.reconciliation.RunReconciliationService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodic tracker reconciliation, followed by the host liveness sweep when
 * infrastructure checks are enabled.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "training-runs.reconciliation.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ReconciliationJob {

    private final RunReconciliationService reconciliationService;
    private final ObjectProvider<OrphanedRunDetector> orphanedRunDetector;
    private final TrainingRunProperties properties;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${training-runs.reconciliation.interval:PT10M}",
            initialDelayString = "${training-runs.reconciliation.initial-delay:PT1M}"
    )
    public void reconcile() {
        Instant startTime = clock.instant();
        Span span = tracer.spanBuilder("training_runs.reconcile")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            ReconciliationSummary summary = reconciliationService.reconcile(
                    ReconciliationOptions.defaults(properties));
            recordSummary("tracker", summary, span);

            OrphanedRunDetector detector = orphanedRunDetector.getIfAvailable();
            if (detector != null) {
                ReconciliationSummary orphans = detector.detectOrphans(ReconciliationOptions.builder()
                        .limit(properties.getInfrastructure().getBatchLimit())
                        .build());
                recordSummary("infrastructure", orphans, span);
            }

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Reconciliation aborted");
            log.error("Scheduled reconciliation failed", e);
            meterRegistry.counter("training.reconciliation.failures").increment();
        } finally {
            span.end();
            meterRegistry.timer("training.reconciliation.duration")
                    .record(Duration.between(startTime, clock.instant()));
        }
    }

    private void recordSummary(String source, ReconciliationSummary summary, Span span) {
        span.setAttribute(source + ".processed", summary.getProcessed());
        span.setAttribute(source + ".errored", summary.getErrored());

        meterRegistry.counter("training.reconciliation.runs", "source", source, "outcome", "updated")
                .increment(summary.getUpdated());
        meterRegistry.counter("training.reconciliation.runs", "source", source, "outcome", "not_found")
                .increment(summary.getNotFound());
        meterRegistry.counter("training.reconciliation.runs", "source", source, "outcome", "marked_stale")
                .increment(summary.getMarkedStale());
        meterRegistry.counter("training.reconciliation.runs", "source", source, "outcome", "errored")
                .increment(summary.getErrored());

        if (summary.getErrored() > 0) {
            log.warn("{} reconciliation had {} failed runs: {}", source, summary.getErrored(), summary.getFailures());
        }
    }
}
