package com.overseer.core.session;

import com.overseer.core.model.WorkflowClass;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks how often each workflow class finished successfully during this session.
 */
public class OutcomeTracker {

    private final Map<WorkflowClass, int[]> counts = new EnumMap<>(WorkflowClass.class);

    public synchronized void record(WorkflowClass workflowClass, boolean success) {
        int[] c = counts.computeIfAbsent(workflowClass, k -> new int[2]);
        if (success) {
            c[0]++;
        } else {
            c[1]++;
        }
    }

    /**
     * Success rate in {@code [0, 1]}, or {@code -1} when no workflow of the class has finished.
     */
    public synchronized double successRate(WorkflowClass workflowClass) {
        int[] c = counts.get(workflowClass);
        if (c == null || c[0] + c[1] == 0) {
            return -1;
        }
        return (double) c[0] / (c[0] + c[1]);
    }

    public synchronized int total(WorkflowClass workflowClass) {
        int[] c = counts.get(workflowClass);
        return c == null ? 0 : c[0] + c[1];
    }

    public synchronized Map<String, Double> rates() {
        var rates = new LinkedHashMap<String, Double>();
        for (WorkflowClass workflowClass : counts.keySet()) {
            rates.put(workflowClass.name(), successRate(workflowClass));
        }
        return rates;
    }
}
