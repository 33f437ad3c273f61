package com.overseer.core.model;

import java.io.Serializable;

/**
 * A stage of a {@link WorkflowPlan}.
 *
 * @param name            unique name within the plan
 * @param ownership       whether one worker or a swarm executes the phase
 * @param verification    verification requirement that must hold before the phase completes
 * @param checkpointAfter whether a checkpoint is recorded once the phase completes
 */
public record Phase(
    String name,
    OwnershipModel ownership,
    VerificationLevel verification,
    boolean checkpointAfter
) implements Serializable {

    public Phase withVerification(VerificationLevel level) {
        return new Phase(name, ownership, level, checkpointAfter);
    }
}
