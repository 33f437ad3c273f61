package com.overseer.core.model;

import java.io.Serializable;

/**
 * Output of request classification: exactly one score and exactly one plan.
 */
public record ClassificationResult(
    Score score,
    WorkflowPlan plan,
    DecisionRationale rationale
) implements Serializable {

    public RiskTier tier() {
        return plan.tier();
    }

    public WorkflowClass workflowClass() {
        return plan.workflowClass();
    }
}
