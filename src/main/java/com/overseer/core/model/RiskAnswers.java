package com.overseer.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * The four questions that must be answered before a T1-T3 task may start.
 */
public record RiskAnswers(
    String failureScenario,
    String detectionSignal,
    String fastestRollback,
    String weakestAssumption
) implements Serializable {

    public static RiskAnswers none() {
        return new RiskAnswers(null, null, null, null);
    }

    /**
     * Names of the fields that are missing or blank, in declaration order.
     */
    public List<String> missingFields() {
        var missing = new ArrayList<String>();
        if (isBlank(failureScenario)) missing.add("failureScenario");
        if (isBlank(detectionSignal)) missing.add("detectionSignal");
        if (isBlank(fastestRollback)) missing.add("fastestRollback");
        if (isBlank(weakestAssumption)) missing.add("weakestAssumption");
        return missing;
    }

    public boolean complete() {
        return missingFields().isEmpty();
    }

    public boolean hasRollbackPlan() {
        return !isBlank(fastestRollback);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
