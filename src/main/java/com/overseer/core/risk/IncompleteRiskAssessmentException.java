package com.overseer.core.risk;

import com.overseer.core.model.RiskTier;

import java.util.List;

/**
 * Thrown when a T1-T3 task lacks one of the four required risk answers.
 * The task must not start.
 */
public class IncompleteRiskAssessmentException extends RuntimeException {

    private final RiskTier tier;
    private final List<String> missingFields;

    public IncompleteRiskAssessmentException(RiskTier tier, List<String> missingFields) {
        super("Risk assessment incomplete for tier " + tier + ": missing " + String.join(", ", missingFields));
        this.tier = tier;
        this.missingFields = List.copyOf(missingFields);
    }

    public RiskTier getTier() {
        return tier;
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
