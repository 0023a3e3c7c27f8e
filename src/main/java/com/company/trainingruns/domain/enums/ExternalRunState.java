package com.company.trainingruns.domain.enums;

import java.util.Locale;

/**
 * Live state reported by the external experiment tracker.
 */
public enum ExternalRunState {
    RUNNING,
    FINISHED,
    FAILED,
    CRASHED,
    KILLED,
    PREEMPTED,
    UNKNOWN;

    /**
     * Every state other than RUNNING collapses to NOT_RUNNING locally.
     */
    public RunStatus toRunStatus() {
        return this == RUNNING ? RunStatus.RUNNING : RunStatus.NOT_RUNNING;
    }

    public String exitReason() {
        return "tracker_" + name().toLowerCase(Locale.ROOT);
    }

    public static ExternalRunState fromString(String state) {
        if (state == null) {
            return UNKNOWN;
        }
        try {
            return ExternalRunState.valueOf(state.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
