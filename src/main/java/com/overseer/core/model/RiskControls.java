package com.overseer.core.model;

import java.io.Serializable;

/**
 * Controls required by a {@link RiskTier}.
 */
public record RiskControls(
    VerificationLevel verification,
    ReviewType review,
    ApprovalMode approval
) implements Serializable {}
