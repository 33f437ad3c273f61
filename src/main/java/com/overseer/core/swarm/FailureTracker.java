package com.overseer.core.swarm;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers verification failures per task within one phase run so a second consecutive
 * failure of the same task escalates instead of spawning another fix.
 */
public class FailureTracker {

    private final ConcurrentHashMap<String, List<String>> failureHistory = new ConcurrentHashMap<>();

    public void recordFailure(String taskId, String detail) {
        failureHistory.computeIfAbsent(taskId, k -> new ArrayList<>()).add(detail == null ? "" : detail);
    }

    public int failureCount(String taskId) {
        var history = failureHistory.get(taskId);
        return history != null ? history.size() : 0;
    }

    /**
     * True once a task has failed at least twice in a row.
     */
    public boolean shouldEscalate(String taskId) {
        return failureCount(taskId) >= 2;
    }

    public void clearHistory(String taskId) {
        failureHistory.remove(taskId);
    }
}
