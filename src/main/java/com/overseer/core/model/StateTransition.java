package com.overseer.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One recorded transition of a workflow or one of its phases.
 *
 * @param subject "workflow" or the phase name
 */
public record StateTransition(
    String subject,
    String from,
    String to,
    String reason,
    Instant at
) implements Serializable {

    public static final String WORKFLOW = "workflow";
}
