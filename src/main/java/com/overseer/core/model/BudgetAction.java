package com.overseer.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A reduction applied by the coordinator to stay under its worker budget or context pressure.
 */
public record BudgetAction(
    Kind kind,
    String detail,
    List<String> taskIds
) implements Serializable {

    public enum Kind {
        MERGED,
        DEFERRED,
        BATCHED,
        EARLY_COMPLETION
    }

    public BudgetAction {
        taskIds = taskIds == null ? List.of() : List.copyOf(taskIds);
    }
}
