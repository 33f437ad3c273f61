package com.overseer.core.model;

/**
 * Ordinal risk classification. Higher tiers demand stronger controls.
 */
public enum RiskTier {
    T0(new RiskControls(VerificationLevel.NONE, ReviewType.SELF, ApprovalMode.AUTOMATIC)),
    T1(new RiskControls(VerificationLevel.BASIC, ReviewType.PEER, ApprovalMode.AUTOMATIC)),
    T2(new RiskControls(VerificationLevel.FULL, ReviewType.SECURITY, ApprovalMode.AUTOMATIC)),
    T3(new RiskControls(VerificationLevel.FULL_SECURITY_ROLLBACK, ReviewType.SECURITY, ApprovalMode.HUMAN_CONFIRMATION));

    private final RiskControls controls;

    RiskTier(RiskControls controls) {
        this.controls = controls;
    }

    public RiskControls controls() {
        return controls;
    }

    public boolean requiresRiskAnswers() {
        return this != T0;
    }

    public boolean requiresHumanConfirmation() {
        return controls.approval() == ApprovalMode.HUMAN_CONFIRMATION;
    }

    public boolean isAtLeast(RiskTier other) {
        return compareTo(other) >= 0;
    }

    public static RiskTier max(RiskTier a, RiskTier b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }
}
