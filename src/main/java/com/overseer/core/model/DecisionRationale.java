package com.overseer.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Why a plan was selected: the rule that fired, how confident the classifier is, the
 * dimensions that drove the decision and the plans that were considered but not chosen.
 *
 * @param margin       distance of the deciding score from the nearest threshold, in {@code [0, 1]};
 *                     small margins mean a small change to the request could flip the decision
 * @param alternatives other rules that matched, strongest first, one per workflow class
 */
public record DecisionRationale(
    String rule,
    double confidence,
    double margin,
    List<String> factors,
    List<Alternative> alternatives
) implements Serializable {

    public DecisionRationale {
        factors = factors == null ? List.of() : List.copyOf(factors);
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public Optional<Alternative> runnerUp() {
        return alternatives.stream().findFirst();
    }

    public String confidenceLevel() {
        if (confidence >= 0.85) {
            return "very high";
        } else if (confidence >= 0.70) {
            return "high";
        } else if (confidence >= 0.55) {
            return "moderate";
        } else if (confidence >= 0.40) {
            return "low";
        }
        return "very low";
    }

    /**
     * A plan the classifier would have selected had the stronger rules not matched.
     */
    public record Alternative(WorkflowClass workflowClass, String rule, double margin) implements Serializable {
    }
}
