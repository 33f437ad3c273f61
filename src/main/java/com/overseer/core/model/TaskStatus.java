package com.overseer.core.model;

public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    /** Worker stalled and a replacement took over. */
    REPLACED,
    /** Not executed (early completion or reduced scope). */
    SKIPPED,
    /** Risk assessment incomplete; the task must not start. */
    BLOCKED;

    public boolean isTerminal() {
        return this != PENDING && this != IN_PROGRESS;
    }
}
