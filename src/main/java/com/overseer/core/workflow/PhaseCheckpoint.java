package com.overseer.core.workflow;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Snapshot recorded after a phase that asks for checkpointing, bounding what later phases
 * need to carry forward.
 */
public record PhaseCheckpoint(
    String phase,
    int phaseIndex,
    List<String> modifiedResources,
    String summary,
    Instant at
) implements Serializable {

    public PhaseCheckpoint {
        modifiedResources = modifiedResources == null ? List.of() : List.copyOf(modifiedResources);
    }
}
