package com.overseer.core.model;

public enum PhaseStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    /** Never started because the workflow aborted earlier. */
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }
}
