package com.overseer.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Caller-facing summary of a workflow run. Internally recovered incidents are only listed here.
 */
public record WorkflowReport(
    String requestId,
    WorkflowStatus status,
    WorkflowClass workflowClass,
    RiskTier tier,
    Map<String, PhaseStatus> phases,
    List<String> modifiedResources,
    List<String> errors,
    List<String> warnings,
    List<String> incidents,
    long elapsedMs
) implements Serializable {

    public boolean awaitingConfirmation() {
        return status == WorkflowStatus.AWAITING_CONFIRMATION;
    }

    public boolean failed() {
        return status == WorkflowStatus.ABORTED_FAILED;
    }
}
