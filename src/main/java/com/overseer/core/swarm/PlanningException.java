package com.overseer.core.swarm;

/**
 * A phase was planned with sibling tasks that claim the same resource. This is a planning bug,
 * never a runtime race, so the phase is refused before any worker starts.
 */
public class PlanningException extends RuntimeException {

    public PlanningException(String message) {
        super(message);
    }
}
