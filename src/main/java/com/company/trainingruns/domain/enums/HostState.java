package com.company.trainingruns.domain.enums;

/**
 * Liveness of the compute host behind a run, as reported by the infrastructure layer.
 */
public enum HostState {
    PENDING(false),
    RUNNING(false),
    STOPPING(false),
    STOPPED(true),
    SHUTTING_DOWN(true),
    TERMINATED(true),
    NOT_FOUND(true),
    UNKNOWN(false);

    private final boolean dead;

    HostState(boolean dead) {
        this.dead = dead;
    }

    /**
     * True when the host can no longer be running the job.
     */
    public boolean isDead() {
        return dead;
    }
}
