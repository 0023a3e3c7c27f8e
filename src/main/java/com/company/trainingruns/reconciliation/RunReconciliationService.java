package com.company.trainingruns.reconciliation;

import com.company.trainingruns.config.TrainingRunProperties;
import com.company.trainingruns.domain.RunUpdate;
import com.company.trainingruns.domain.TrainingRun;
import com.company.trainingruns.domain.enums.RunStatus;
import com.company.trainingruns.event.RunStatusChangedEvent;
import com.company.trainingruns.exception.ExternalServiceException;
import com.company.trainingruns.exception.MalformedDataException;
import com.company.trainingruns.exception.RunNotFoundException;
import com.company.trainingruns.matching.IdentityMatcher;
import com.company.trainingruns.repository.TrainingRunRepository;
import com.company.trainingruns.service.ObjectiveMetricService;
import com.company.trainingruns.service.ObjectiveMetricUpdateResult;
import com.company.trainingruns.tracker.ExternalTrackerClient;
import com.company.trainingruns.tracker.TrackerRun;
import com.company.trainingruns.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converges local run state toward what the tracker reports.
 * <p>
 * Each run is processed in its own failure boundary: a tracker timeout, malformed
 * data or a conflicting write costs only that run and is recorded in the summary.
 * Only an unreachable database aborts the invocation. Nothing is retried here; the
 * next invocation picks the run up again.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RunReconciliationService {

    static final String NEVER_REGISTERED = "never_registered";
    private static final String LISTING_ORDER = "-created_at";

    private final TrainingRunRepository runRepository;
    private final ExternalTrackerClient trackerClient;
    private final IdentityMatcher identityMatcher;
    private final TrackerRunMapper trackerRunMapper;
    private final ObjectiveMetricService objectiveMetricService;
    private final TrainingRunProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ReconciliationSummary reconcile(ReconciliationOptions options) {
        ReconciliationSummary summary = new ReconciliationSummary(options.isDryRun());
        List<TrainingRun> runs = runRepository.findRunsNeedingSync(options.getLimit());

        log.info("Reconciling {} runs (limit={}, dryRun={}, markStale={})",
                runs.size(), options.getLimit(), options.isDryRun(), options.isMarkStale());

        TrackerListing listing = new TrackerListing();

        for (TrainingRun run : runs) {
            MDC.put("runId", run.getRunId());
            try {
                reconcileRun(run, options, listing, summary);

            } catch (DataAccessResourceFailureException e) {
                log.error("Database unavailable, aborting reconciliation after {} runs", summary.getProcessed(), e);
                throw e;
            } catch (ExternalServiceException e) {
                log.warn("Tracker call failed for run {}: {}", run.getRunId(), e.getMessage());
                summary.recordErrored(run.getRunId(), FailureCategory.EXTERNAL_SERVICE, e.getMessage());
            } catch (MalformedDataException e) {
                log.warn("Malformed tracker data for run {}: {}", run.getRunId(), e.getMessage());
                summary.recordErrored(run.getRunId(), FailureCategory.MALFORMED_DATA, e.getMessage());
            } catch (RunNotFoundException e) {
                log.info("Run {} was deleted during reconciliation", run.getRunId());
                summary.recordErrored(run.getRunId(), FailureCategory.NOT_FOUND, e.getMessage());
            } catch (DataIntegrityViolationException e) {
                log.warn("Conflicting write for run {}", run.getRunId(), e);
                summary.recordErrored(run.getRunId(), FailureCategory.CONFLICT,
                        e.getMostSpecificCause().getMessage());
            } catch (Exception e) {
                log.error("Unexpected failure reconciling run {}", run.getRunId(), e);
                summary.recordErrored(run.getRunId(), FailureCategory.UNEXPECTED, e.toString());
            } finally {
                MDC.remove("runId");
            }
        }

        log.info("Reconciliation finished: {}", summary);
        return summary;
    }

    private void reconcileRun(TrainingRun run, ReconciliationOptions options, TrackerListing listing,
                              ReconciliationSummary summary) {
        Optional<TrackerRun> found = lookup(run, listing);
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);

        if (found.isEmpty()) {
            handleNotFound(run, options, now, summary);
            return;
        }

        TrackerRun record = found.get();
        List<Map<String, Object>> history = trackerClient.scanHistory(entity(), project(), record.getId());
        RunStatus status = record.getExternalState().toRunStatus();
        RunUpdate update = trackerRunMapper.toUpdate(run, record, history, now);

        if (options.isDryRun()) {
            log.info("[dry run] Would set run {} to {} with {}", run.getRunId(), status.getValue(), update);
            summary.recordSkipped();
            return;
        }

        runRepository.updateStatus(run.getRunId(), status, update);

        ObjectiveMetricUpdateResult metrics = objectiveMetricService.applyTrackerMetrics(
                run.getRunId(), trackerRunMapper.latestMetrics(record, history));
        for (String key : metrics.getMalformedKeys()) {
            summary.recordPartialFailure(run.getRunId(), FailureCategory.MALFORMED_DATA,
                    "non-numeric value for " + key);
        }

        if (run.getStatus() != status && run.getStatus().canTransitionTo(status)) {
            eventPublisher.publishEvent(new RunStatusChangedEvent(run.getRunId(), status,
                    status.isTerminal() ? record.getExternalState().exitReason() : null));
            meterRegistry.counter("training.reconciliation.transitions",
                    "from", run.getStatus().getValue(),
                    "to", status.getValue()
            ).increment();
        }

        log.debug("Run {} synced from tracker run {} ({})", run.getRunId(), record.getId(), record.getState());
        summary.recordUpdated();
    }

    private void handleNotFound(TrainingRun run, ReconciliationOptions options, Instant now,
                                ReconciliationSummary summary) {
        Duration staleThreshold = properties.getReconciliation().getStaleThreshold();

        boolean stale = run.getStatus() == RunStatus.LAUNCHED
                && TimeUtils.isOlderThan(run.getCreatedAt(), staleThreshold, now);

        if (!stale || !options.isMarkStale()) {
            log.debug("No tracker record for run {}", run.getRunId());
            summary.recordNotFound();
            return;
        }

        if (options.isDryRun()) {
            log.info("[dry run] Would mark run {} stale (created {})", run.getRunId(), run.getCreatedAt());
            summary.recordSkipped();
            return;
        }

        runRepository.updateStatus(run.getRunId(), RunStatus.NOT_RUNNING,
                RunUpdate.empty().exitReason(NEVER_REGISTERED).endedAt(now));
        eventPublisher.publishEvent(new RunStatusChangedEvent(run.getRunId(), RunStatus.NOT_RUNNING, NEVER_REGISTERED));

        log.warn("Run {} never registered with the tracker after {}, marked not running",
                run.getRunId(), staleThreshold);
        summary.recordMarkedStale();
    }

    /**
     * By stored external id, else by exact display name (newest wins), else through the
     * identity matcher over the tracker's full listing.
     */
    private Optional<TrackerRun> lookup(TrainingRun run, TrackerListing listing) {
        if (run.hasExternalRunId()) {
            return trackerClient.getById(entity(), project(), run.getExternalRunId());
        }

        if (run.hasDisplayName()) {
            List<TrackerRun> byName = trackerClient.searchByName(entity(), project(), run.getDisplayName());
            Optional<TrackerRun> newest = byName.stream()
                    .max(Comparator.comparing(TrackerRun::getCreatedAt,
                            Comparator.nullsFirst(Comparator.naturalOrder())));
            if (newest.isPresent()) {
                return newest;
            }
        }

        Optional<TrackerRun> matched = identityMatcher.match(run, listing.unclaimed());
        matched.ifPresent(listing::claim);
        return matched;
    }

    private String entity() {
        return properties.getTracker().getEntity();
    }

    private String project() {
        return properties.getTracker().getProject();
    }

    /**
     * Tracker listing fetched at most once per invocation. A failed fetch is remembered
     * so later runs fail fast with the same error.
     * <p>
     * Records already linked to a local run, or matched earlier in this invocation, are
     * withheld from the matcher: the external id is unique, so offering them again could
     * only end in a conflicting write.
     */
    private final class TrackerListing {
        private List<TrackerRun> runs;
        private ExternalServiceException failure;
        private final Set<String> claimed = new HashSet<>();

        List<TrackerRun> unclaimed() {
            if (failure != null) {
                throw failure;
            }
            if (runs == null) {
                List<TrackerRun> fetched;
                try {
                    fetched = trackerClient.listAll(entity(), project(), LISTING_ORDER);
                } catch (ExternalServiceException e) {
                    failure = e;
                    throw e;
                }
                claimed.addAll(runRepository.findLinkedExternalRunIds(fetched.stream()
                        .map(TrackerRun::getId)
                        .filter(Objects::nonNull)
                        .collect(Collectors.toList())));
                runs = fetched;
                log.debug("Fetched {} tracker runs for matching, {} already linked", runs.size(), claimed.size());
            }
            return runs.stream()
                    .filter(r -> r.getId() == null || !claimed.contains(r.getId()))
                    .collect(Collectors.toList());
        }

        void claim(TrackerRun record) {
            if (record.getId() != null) {
                claimed.add(record.getId());
            }
        }
    }
}
