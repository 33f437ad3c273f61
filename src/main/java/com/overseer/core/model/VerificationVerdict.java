package com.overseer.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Pass/fail judgement for one task, with detail and the names of failing checks.
 */
public record VerificationVerdict(
    boolean passed,
    String detail,
    List<String> failingChecks
) implements Serializable {

    public static final String SECURITY_CHECK = "security";

    public VerificationVerdict {
        detail = detail == null ? "" : detail;
        failingChecks = failingChecks == null ? List.of() : List.copyOf(failingChecks);
    }

    public static VerificationVerdict pass(String detail) {
        return new VerificationVerdict(true, detail, List.of());
    }

    public static VerificationVerdict fail(String detail, List<String> failingChecks) {
        return new VerificationVerdict(false, detail, failingChecks);
    }

    public boolean failsSecurity() {
        return failingChecks.contains(SECURITY_CHECK);
    }
}
