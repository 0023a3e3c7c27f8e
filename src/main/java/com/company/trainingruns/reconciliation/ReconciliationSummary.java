package com.company.trainingruns.reconciliation;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome counts of one invocation, with every failure attributed to its run.
 * <p>
 * {@code errored} counts runs whose processing was abandoned. Problems that only
 * cost part of a run's data (a malformed metric value) appear in {@code failures}
 * while the run itself still counts as updated.
 */
@Getter
public class ReconciliationSummary {

    private final boolean dryRun;
    private int processed;
    private int updated;
    private int notFound;
    private int markedStale;
    private int errored;
    private int skipped;
    private final List<RunSyncFailure> failures = new ArrayList<>();

    public ReconciliationSummary(boolean dryRun) {
        this.dryRun = dryRun;
    }

    void recordUpdated() {
        processed++;
        updated++;
    }

    void recordNotFound() {
        processed++;
        notFound++;
    }

    void recordMarkedStale() {
        processed++;
        markedStale++;
    }

    /**
     * A write that a dry run suppressed.
     */
    void recordSkipped() {
        processed++;
        skipped++;
    }

    void recordErrored(String runId, FailureCategory category, String reason) {
        processed++;
        errored++;
        failures.add(new RunSyncFailure(runId, category, reason));
    }

    void recordPartialFailure(String runId, FailureCategory category, String reason) {
        failures.add(new RunSyncFailure(runId, category, reason));
    }

    public List<RunSyncFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    @Override
    public String toString() {
        return String.format("processed=%d updated=%d notFound=%d markedStale=%d errored=%d skipped=%d%s",
                processed, updated, notFound, markedStale, errored, skipped, dryRun ? " (dry run)" : "");
    }
}
