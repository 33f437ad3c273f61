package com.overseer.core.nodes;

import com.overseer.core.hooks.HookResult;
import com.overseer.core.hooks.HookStatus;
import com.overseer.core.workflow.WorkflowInstance;

import java.util.List;

/**
 * Hook faults are recovered internally; they only surface as incidents in the report.
 */
final class HookOutcomes {

    private HookOutcomes() {}

    static void record(WorkflowInstance instance, List<HookResult> results) {
        for (HookResult result : results) {
            if (result.status() == HookStatus.FAILED || result.status() == HookStatus.TIMEOUT) {
                instance.addIncident("hook '" + result.hookName() + "' at " + result.point()
                        + " " + result.status() + ": " + result.error());
            }
        }
    }
}
