package com.overseer.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;

/**
 * What the risk classifier sees of a unit of work.
 */
public record TaskDescriptor(
    String description,
    List<String> resources,
    RiskAnswers answers
) implements Serializable {

    public TaskDescriptor {
        description = description == null ? "" : description;
        resources = resources == null ? List.of() : List.copyOf(resources);
        answers = answers == null ? RiskAnswers.none() : answers;
    }

    public static TaskDescriptor of(Request request) {
        return new TaskDescriptor(request.description(), request.fileHints(), request.riskAnswers());
    }

    public static TaskDescriptor of(AgentTask task, RiskAnswers answers) {
        return new TaskDescriptor(task.description(), task.resources(), answers);
    }

    /**
     * Stable identity used by the session risk ledger.
     */
    public String key() {
        var sorted = resources.stream().sorted().toList();
        return description.strip().toLowerCase(Locale.ROOT) + "|" + String.join(",", sorted);
    }
}
