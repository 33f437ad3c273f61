package com.overseer.core.model;

/**
 * Scoring dimensions evaluated for every request.
 */
public enum Dimension {
    TECHNICAL_COMPLEXITY("technical complexity"),
    SCOPE("scope"),
    RISK("risk"),
    CONTEXT_LOAD("context load"),
    TIME_PRESSURE("time pressure"),
    MINIMALISM("code minimalism pressure"),
    SECURITY("security sensitivity"),
    REUSABILITY("pattern reusability");

    private final String label;

    Dimension(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
