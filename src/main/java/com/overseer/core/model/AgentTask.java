package com.overseer.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A unit of work assigned to one worker within a phase.
 * Sibling tasks never declare overlapping resources.
 */
public record AgentTask(
    String id,
    String phase,
    String description,
    List<String> resources,
    boolean critical,
    RiskTier riskTier,
    TaskStatus status,
    String assignedWorkerId,
    Instant startedAt
) implements Serializable {

    public AgentTask {
        resources = resources == null ? List.of() : List.copyOf(resources);
        riskTier = riskTier == null ? RiskTier.T0 : riskTier;
        status = status == null ? TaskStatus.PENDING : status;
    }

    public static AgentTask pending(String id, String phase, String description,
                                    List<String> resources, boolean critical) {
        return new AgentTask(id, phase, description, resources, critical, RiskTier.T0,
                TaskStatus.PENDING, null, null);
    }

    public AgentTask withStatus(TaskStatus newStatus) {
        return new AgentTask(id, phase, description, resources, critical, riskTier,
                newStatus, assignedWorkerId, startedAt);
    }

    public AgentTask withRiskTier(RiskTier tier) {
        return new AgentTask(id, phase, description, resources, critical, tier,
                status, assignedWorkerId, startedAt);
    }

    public AgentTask assignedTo(String workerId, Instant at) {
        return new AgentTask(id, phase, description, resources, critical, riskTier,
                TaskStatus.IN_PROGRESS, workerId, at);
    }
}
