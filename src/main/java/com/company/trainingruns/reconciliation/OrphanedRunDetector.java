package com.company.trainingruns.reconciliation;

import com.company.trainingruns.config.TrainingRunProperties;
import com.company.trainingruns.domain.RunUpdate;
import com.company.trainingruns.domain.TrainingRun;
import com.company.trainingruns.domain.enums.HostState;
import com.company.trainingruns.domain.enums.RunStatus;
import com.company.trainingruns.event.RunStatusChangedEvent;
import com.company.trainingruns.exception.ExternalServiceException;
import com.company.trainingruns.exception.RunNotFoundException;
import com.company.trainingruns.infrastructure.HostLivenessClient;
import com.company.trainingruns.repository.TrainingRunRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stops runs whose compute host is gone, independently of the tracker. Catches jobs
 * that died before the tracker was initialised.
 * <p>
 * Runs without an infrastructure host id, or on an exempt host label (non-cloud
 * execution), are never checked.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "training-runs.infrastructure.enabled",
        havingValue = "true"
)
public class OrphanedRunDetector {

    static final String HOST_PREFIX = "host_";

    private final TrainingRunRepository runRepository;
    private final HostLivenessClient hostLivenessClient;
    private final TrainingRunProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ReconciliationSummary detectOrphans(ReconciliationOptions options) {
        ReconciliationSummary summary = new ReconciliationSummary(options.isDryRun());
        Set<String> exempt = properties.getInfrastructure().getExemptHosts().stream()
                .map(h -> h.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        List<TrainingRun> candidates = runRepository.findActiveWithInfraHost(options.getLimit()).stream()
                .filter(run -> run.getHost() == null || !exempt.contains(run.getHost().toLowerCase(Locale.ROOT)))
                .collect(Collectors.toList());

        log.info("Checking host liveness for {} runs", candidates.size());

        for (TrainingRun run : candidates) {
            MDC.put("runId", run.getRunId());
            try {
                checkRun(run, options, summary);

            } catch (DataAccessResourceFailureException e) {
                log.error("Database unavailable, aborting orphan detection", e);
                throw e;
            } catch (ExternalServiceException e) {
                log.warn("Host check failed for run {}: {}", run.getRunId(), e.getMessage());
                summary.recordErrored(run.getRunId(), FailureCategory.EXTERNAL_SERVICE, e.getMessage());
            } catch (RunNotFoundException e) {
                summary.recordErrored(run.getRunId(), FailureCategory.NOT_FOUND, e.getMessage());
            } catch (Exception e) {
                log.error("Unexpected failure checking host of run {}", run.getRunId(), e);
                summary.recordErrored(run.getRunId(), FailureCategory.UNEXPECTED, e.toString());
            } finally {
                MDC.remove("runId");
            }
        }

        log.info("Orphan detection finished: {}", summary);
        return summary;
    }

    private void checkRun(TrainingRun run, ReconciliationOptions options, ReconciliationSummary summary) {
        HostState state = hostLivenessClient.describeHost(run.getInfraHostId());

        if (!state.isDead()) {
            log.debug("Host {} of run {} is {}", run.getInfraHostId(), run.getRunId(), state);
            summary.recordUpdated();
            return;
        }

        if (options.isDryRun()) {
            log.info("[dry run] Would stop run {}: host {} is {}", run.getRunId(), run.getInfraHostId(), state);
            summary.recordSkipped();
            return;
        }

        String exitReason = HOST_PREFIX + state.name().toLowerCase(Locale.ROOT);
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);

        runRepository.updateStatus(run.getRunId(), RunStatus.NOT_RUNNING,
                RunUpdate.empty().exitReason(exitReason).endedAt(now));
        eventPublisher.publishEvent(new RunStatusChangedEvent(run.getRunId(), RunStatus.NOT_RUNNING, exitReason));

        meterRegistry.counter("training.runs.orphaned", "host_state", state.name()).increment();
        log.warn("Run {} marked not running: host {} is {}", run.getRunId(), run.getInfraHostId(), state);
        summary.recordMarkedStale();
    }
}
