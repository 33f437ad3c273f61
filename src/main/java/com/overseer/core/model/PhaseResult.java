package com.overseer.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combined result of one phase run, produced by the swarm coordinator.
 *
 * @param tasks          the tasks as planned (risk tiers included)
 * @param outcomes       per-task outcome keyed by task id, in task order
 * @param escalated      ids of tasks that failed verification after their targeted fix
 * @param stalledWorkers ids of workers that were replaced after stalling
 * @param fixWorkers     ids of targeted-fix workers spawned
 * @param budgetActions  reductions applied while scheduling waves
 * @param conservation   whether conservation mode was active at the end of the phase
 */
public record PhaseResult(
    String phase,
    List<AgentTask> tasks,
    Map<String, TaskOutcome> outcomes,
    List<String> escalated,
    List<String> stalledWorkers,
    List<String> fixWorkers,
    List<BudgetAction> budgetActions,
    boolean conservation,
    long durationMs
) implements Serializable {

    public PhaseResult {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        outcomes = outcomes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        escalated = escalated == null ? List.of() : List.copyOf(escalated);
        stalledWorkers = stalledWorkers == null ? List.of() : List.copyOf(stalledWorkers);
        fixWorkers = fixWorkers == null ? List.of() : List.copyOf(fixWorkers);
        budgetActions = budgetActions == null ? List.of() : List.copyOf(budgetActions);
    }

    public static PhaseResult empty(String phase) {
        return new PhaseResult(phase, List.of(), Map.of(), List.of(), List.of(), List.of(), List.of(), false, 0L);
    }

    public TaskOutcome outcome(String taskId) {
        return outcomes.get(taskId);
    }

    public List<String> failingTaskIds() {
        return outcomes.values().stream()
                .filter(TaskOutcome::executed)
                .filter(o -> !o.passed())
                .map(TaskOutcome::taskId)
                .toList();
    }

    public boolean containsTier(RiskTier tier) {
        return tasks.stream().anyMatch(t -> t.riskTier() == tier);
    }

    public boolean isCritical(String taskId) {
        return tasks.stream().anyMatch(t -> t.id().equals(taskId) && t.critical());
    }

    /**
     * Copy with the given tasks marked skipped and removed from the escalation list.
     */
    public PhaseResult dropping(List<String> taskIds) {
        var reduced = new LinkedHashMap<String, TaskOutcome>();
        outcomes.forEach((id, outcome) ->
                reduced.put(id, taskIds.contains(id) ? outcome.withStatus(TaskStatus.SKIPPED) : outcome));
        var remaining = escalated.stream().filter(id -> !taskIds.contains(id)).toList();
        return new PhaseResult(phase, tasks, reduced, remaining, stalledWorkers, fixWorkers,
                budgetActions, conservation, durationMs);
    }

    public List<String> modifiedResources() {
        return outcomes.values().stream()
                .flatMap(o -> o.modifiedResources().stream())
                .distinct()
                .toList();
    }
}
