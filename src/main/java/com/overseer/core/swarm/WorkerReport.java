package com.overseer.core.swarm;

import java.util.List;

/**
 * What a worker hands back. Workers communicate with the coordinator only through this
 * return value and the progress signal on their {@link WorkerContext}.
 */
public record WorkerReport(
    List<String> modifiedResources,
    String summary,
    boolean success,
    String error
) {

    public WorkerReport {
        modifiedResources = modifiedResources == null ? List.of() : List.copyOf(modifiedResources);
        summary = summary == null ? "" : summary;
    }

    public static WorkerReport success(List<String> modifiedResources, String summary) {
        return new WorkerReport(modifiedResources, summary, true, null);
    }

    public static WorkerReport failure(String error) {
        return new WorkerReport(List.of(), "", false, error);
    }
}
