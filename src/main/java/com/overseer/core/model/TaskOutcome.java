package com.overseer.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Final outcome of one task within a phase run.
 *
 * @param workerId          the worker whose output was accepted (replacement or fix worker ids included)
 * @param verdict           verification verdict, or {@code null} when the phase is not verified
 * @param fixAttempts       number of targeted-fix workers spawned for this task
 */
public record TaskOutcome(
    String taskId,
    TaskStatus status,
    String workerId,
    List<String> modifiedResources,
    String summary,
    String error,
    VerificationVerdict verdict,
    int fixAttempts
) implements Serializable {

    public TaskOutcome {
        modifiedResources = modifiedResources == null ? List.of() : List.copyOf(modifiedResources);
        summary = summary == null ? "" : summary;
    }

    /**
     * A task passes only if its worker completed and no verdict says otherwise.
     */
    public boolean passed() {
        return status == TaskStatus.COMPLETED && (verdict == null || verdict.passed());
    }

    /**
     * False for tasks that never ran (skipped or blocked by the risk gate).
     */
    public boolean executed() {
        return status != TaskStatus.SKIPPED && status != TaskStatus.BLOCKED;
    }

    public TaskOutcome withVerdict(VerificationVerdict newVerdict) {
        return new TaskOutcome(taskId, status, workerId, modifiedResources, summary, error, newVerdict, fixAttempts);
    }

    public TaskOutcome withStatus(TaskStatus newStatus) {
        return new TaskOutcome(taskId, newStatus, workerId, modifiedResources, summary, error, verdict, fixAttempts);
    }

    public TaskOutcome withFixAttempts(int attempts) {
        return new TaskOutcome(taskId, status, workerId, modifiedResources, summary, error, verdict, attempts);
    }
}
