package com.overseer.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Ordered phases selected for a request together with the governing risk tier.
 *
 * @param conservative true when this is the fallback plan chosen because a dimension was unscorable
 */
public record WorkflowPlan(
    WorkflowClass workflowClass,
    RiskTier tier,
    List<Phase> phases,
    boolean conservative
) implements Serializable {

    public WorkflowPlan {
        if (phases == null || phases.isEmpty()) {
            throw new IllegalArgumentException("A workflow plan needs at least one phase");
        }
        phases = List.copyOf(phases);
    }

    public boolean checkpointing() {
        return phases.stream().anyMatch(Phase::checkpointAfter);
    }

    public Phase phase(int index) {
        return phases.get(index);
    }

    public int size() {
        return phases.size();
    }
}
