package com.overseer.core.model;

public enum WorkflowStatus {
    NOT_STARTED,
    RUNNING,
    AWAITING_CONFIRMATION,
    ALL_PHASES_COMPLETED,
    /** All phases completed but a blocking stop hook requires operator acknowledgment. */
    COMPLETION_HELD,
    ABORTED_FAILED;

    public boolean isTerminal() {
        return this == ALL_PHASES_COMPLETED || this == COMPLETION_HELD || this == ABORTED_FAILED;
    }
}
