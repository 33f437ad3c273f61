package com.overseer.core.classifier;

import com.overseer.core.model.OwnershipModel;
import com.overseer.core.model.Phase;
import com.overseer.core.model.RiskTier;
import com.overseer.core.model.VerificationLevel;
import com.overseer.core.model.WorkflowClass;
import com.overseer.core.model.WorkflowPlan;

import java.util.List;

/**
 * Phase templates per workflow class. Planning and analysis phases are not verified;
 * every other phase inherits the verification level of the governing risk tier.
 */
public final class WorkflowPlanner {

    private WorkflowPlanner() {}

    public static WorkflowPlan plan(WorkflowClass workflowClass, RiskTier tier) {
        VerificationLevel level = tier.controls().verification();
        List<Phase> phases = switch (workflowClass) {
            case DIRECT -> List.of(
                    new Phase("execute", OwnershipModel.SINGLE_AGENT, level, false));
            case STANDARD -> List.of(
                    new Phase("plan", OwnershipModel.SINGLE_AGENT, VerificationLevel.NONE, false),
                    new Phase("implement", OwnershipModel.PARALLEL_SWARM, level, false),
                    new Phase("verify", OwnershipModel.SINGLE_AGENT, level, false));
            case PHASED -> List.of(
                    new Phase("analyze", OwnershipModel.SINGLE_AGENT, VerificationLevel.NONE, true),
                    new Phase("implement", OwnershipModel.PARALLEL_SWARM, level, true),
                    new Phase("integrate", OwnershipModel.PARALLEL_SWARM, level, true),
                    new Phase("verify", OwnershipModel.SINGLE_AGENT, level, false));
        };
        return new WorkflowPlan(workflowClass, tier, phases, false);
    }

    /**
     * Fully phased plan in which every phase after analysis is verified at least at FULL,
     * whatever the tier. Tiers that already demand more keep their own level, so a rollback
     * plan is only required where the tier's risk answers supply one.
     */
    public static WorkflowPlan conservative(RiskTier tier) {
        VerificationLevel floor = atLeast(tier.controls().verification(), VerificationLevel.FULL);
        List<Phase> phases = plan(WorkflowClass.PHASED, tier).phases().stream()
                .map(p -> p.name().equals("analyze") ? p : p.withVerification(atLeast(p.verification(), floor)))
                .toList();
        return new WorkflowPlan(WorkflowClass.PHASED, tier, phases, true);
    }

    private static VerificationLevel atLeast(VerificationLevel level, VerificationLevel floor) {
        return level.compareTo(floor) >= 0 ? level : floor;
    }
}
