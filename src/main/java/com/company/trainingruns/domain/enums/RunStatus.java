package com.company.trainingruns.domain.enums;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Local lifecycle status of a training run.
 * <p>
 * Transitions only move forward: LAUNCHED -> RUNNING -> NOT_RUNNING, or
 * LAUNCHED -> NOT_RUNNING directly. NOT_RUNNING is terminal.
 */
public enum RunStatus {
    LAUNCHED("launched", 0, "Registered at launch, not yet seen by the tracker"),
    RUNNING("running", 1, "Tracker reports the run as live"),
    NOT_RUNNING("not_running", 2, "Run has stopped for any reason");

    private static final List<String> LEGACY_TERMINAL_LABELS =
            List.of("completed", "finished", "failed", "crashed", "killed", "preempted");

    private final String value;
    private final int rank;
    private final String description;

    RunStatus(String value, int rank, String description) {
        this.value = value;
        this.rank = rank;
        this.description = description;
    }

    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == NOT_RUNNING;
    }

    public boolean canTransitionTo(RunStatus target) {
        return target != null && target.rank >= this.rank;
    }

    /**
     * Statuses a run must not be in for a write of this status to apply.
     */
    public List<RunStatus> laterStatuses() {
        return Arrays.stream(values())
                .filter(s -> s.rank > this.rank)
                .collect(Collectors.toList());
    }

    /**
     * Every label a row in this status may carry in the database. NOT_RUNNING also
     * covers the legacy terminal labels.
     */
    public List<String> storedValues() {
        if (this != NOT_RUNNING) {
            return List.of(value);
        }
        List<String> labels = new ArrayList<>();
        labels.add(value);
        labels.addAll(LEGACY_TERMINAL_LABELS);
        return labels;
    }

    /**
     * Parses a stored status. Labels written before the binary running/not-running
     * model (completed, failed, crashed, ...) collapse to NOT_RUNNING.
     */
    public static RunStatus fromDatabase(String status) {
        if (status == null) {
            return LAUNCHED;
        }
        String normalized = status.trim().toLowerCase(Locale.ROOT);
        for (RunStatus candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        if (LEGACY_TERMINAL_LABELS.contains(normalized)) {
            return NOT_RUNNING;
        }
        throw new IllegalArgumentException("Unknown run status: " + status);
    }
}
