package com.overseer.core.swarm;

import com.overseer.core.model.AgentTask;
import com.overseer.core.model.BudgetAction;
import com.overseer.core.model.RiskTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Shapes a phase's tasks into waves that never exceed the concurrent-worker ceiling.
 * When the tasks do not fit, reductions are applied in order: merge tasks with related
 * resources into one worker, defer non-critical work to trailing waves, then split into
 * sequential batches. More workers than the ceiling are never launched.
 */
public class BudgetPolicy {

    private static final Logger log = LoggerFactory.getLogger(BudgetPolicy.class);

    private final int ceiling;

    public BudgetPolicy(int ceiling) {
        if (ceiling < 1) {
            throw new IllegalArgumentException("Worker ceiling must be at least 1, got " + ceiling);
        }
        this.ceiling = ceiling;
    }

    public int ceiling() {
        return ceiling;
    }

    /**
     * Ceiling in force; conservation mode halves it.
     */
    public int effectiveCeiling(boolean conservation) {
        return conservation ? Math.max(1, ceiling / 2) : ceiling;
    }

    public WavePlan plan(List<AgentTask> tasks, boolean conservation) {
        if (tasks.isEmpty()) {
            return new WavePlan(List.of(), List.of());
        }
        int limit = effectiveCeiling(conservation);
        var actions = new ArrayList<BudgetAction>();
        List<WorkUnit> units = tasks.stream().map(WorkUnit::single).toList();

        if (units.size() <= limit && !conservation) {
            return new WavePlan(List.of(units), List.of());
        }

        units = merge(units, actions);
        if (units.size() <= limit) {
            return new WavePlan(List.of(units), actions);
        }

        var critical = units.stream().filter(WorkUnit::critical).toList();
        var deferrable = units.stream().filter(u -> !u.critical()).toList();
        var ordered = new ArrayList<List<WorkUnit>>();
        if (!critical.isEmpty() && !deferrable.isEmpty()) {
            var deferredIds = deferrable.stream().flatMap(u -> u.memberIds().stream()).toList();
            actions.add(new BudgetAction(BudgetAction.Kind.DEFERRED,
                    deferredIds.size() + " non-critical task(s) deferred to trailing waves", deferredIds));
            log.info("Deferred {} non-critical task(s) behind {} critical worker(s)", deferredIds.size(), critical.size());
            ordered.add(critical);
            ordered.add(deferrable);
        } else {
            ordered.add(units);
        }

        var waves = new ArrayList<List<WorkUnit>>();
        var batched = new ArrayList<String>();
        for (List<WorkUnit> group : ordered) {
            if (group.size() > limit) {
                group.forEach(u -> batched.addAll(u.memberIds()));
            }
            for (int from = 0; from < group.size(); from += limit) {
                waves.add(List.copyOf(group.subList(from, Math.min(group.size(), from + limit))));
            }
        }
        if (!batched.isEmpty()) {
            actions.add(new BudgetAction(BudgetAction.Kind.BATCHED,
                    waves.size() + " sequential batches of at most " + limit + " workers", batched));
            log.info("Split {} workers into {} sequential batches (ceiling {})",
                    units.size(), waves.size(), limit);
        }
        return new WavePlan(waves, actions);
    }

    /**
     * Merges tasks whose resources share a parent directory. Tasks without resources stay alone.
     */
    List<WorkUnit> merge(List<WorkUnit> units, List<BudgetAction> actions) {
        var groups = new LinkedHashMap<String, List<AgentTask>>();
        int solo = 0;
        for (WorkUnit unit : units) {
            AgentTask task = unit.task();
            String key = task.resources().isEmpty()
                    ? "\u0000" + solo++
                    : ResourcePartition.parentOf(task.resources().get(0));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(task);
        }
        var merged = new ArrayList<WorkUnit>();
        for (var entry : groups.entrySet()) {
            List<AgentTask> members = entry.getValue();
            if (members.size() == 1) {
                merged.add(WorkUnit.single(members.get(0)));
                continue;
            }
            merged.add(new WorkUnit(combine(members), members));
            var ids = members.stream().map(AgentTask::id).toList();
            String scope = entry.getKey().isEmpty() ? "<root>" : entry.getKey();
            actions.add(new BudgetAction(BudgetAction.Kind.MERGED,
                    ids.size() + " tasks under " + scope + " merged into one worker", ids));
            log.debug("Merged {} into one worker ({})", ids, scope);
        }
        return merged;
    }

    private static AgentTask combine(List<AgentTask> members) {
        AgentTask first = members.get(0);
        var resources = new LinkedHashSet<String>();
        var descriptions = new ArrayList<String>();
        boolean critical = false;
        var tier = first.riskTier();
        for (AgentTask member : members) {
            resources.addAll(member.resources());
            descriptions.add(member.description());
            critical |= member.critical();
            tier = RiskTier.max(tier, member.riskTier());
        }
        String id = first.id() + "+" + (members.size() - 1);
        return AgentTask.pending(id, first.phase(), String.join("; ", descriptions),
                List.copyOf(resources), critical).withRiskTier(tier);
    }

    /**
     * Waves in launch order plus the reductions that produced them.
     */
    public record WavePlan(List<List<WorkUnit>> waves, List<BudgetAction> actions) {

        public WavePlan {
            waves = List.copyOf(waves);
            actions = List.copyOf(actions);
        }

        public int workerCount() {
            return waves.stream().mapToInt(List::size).sum();
        }

        public int maxWaveSize() {
            return waves.stream().mapToInt(List::size).max().orElse(0);
        }
    }
}
