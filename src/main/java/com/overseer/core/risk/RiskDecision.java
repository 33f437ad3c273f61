package com.overseer.core.risk;

import com.overseer.core.model.RiskTier;

import java.io.Serializable;

/**
 * A tier together with the decision-tree branch that produced it.
 */
public record RiskDecision(RiskTier tier, String reason) implements Serializable {}
