package com.overseer.core.swarm;

import com.overseer.core.model.AgentTask;
import com.overseer.core.model.BudgetAction;
import com.overseer.core.model.RiskTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BudgetPolicyTest {

    private static AgentTask task(String id, String resource, boolean critical) {
        return AgentTask.pending(id, "implement", "change " + id, List.of(resource), critical);
    }

    private static List<BudgetAction.Kind> kinds(BudgetPolicy.WavePlan plan) {
        return plan.actions().stream().map(BudgetAction::kind).toList();
    }

    @Test
    @DisplayName("Tasks under the ceiling run in a single wave without reductions")
    void underCeiling() {
        var plan = new BudgetPolicy(20).plan(List.of(task("a", "src/a/A.java", true),
                task("b", "src/b/B.java", false)), false);

        assertEquals(1, plan.waves().size());
        assertEquals(2, plan.workerCount());
        assertTrue(plan.actions().isEmpty());
    }

    @Test
    @DisplayName("Tasks sharing a directory are merged into one worker first")
    void mergesRelatedResources() {
        var plan = new BudgetPolicy(2).plan(List.of(
                task("x", "src/a/X.java", true),
                task("y", "src/a/Y.java", false).withRiskTier(RiskTier.T2),
                task("z", "src/b/Z.java", true)), false);

        assertEquals(List.of(BudgetAction.Kind.MERGED), kinds(plan));
        assertEquals(List.of("x", "y"), plan.actions().get(0).taskIds());
        assertEquals(1, plan.waves().size());

        WorkUnit merged = plan.waves().get(0).get(0);
        assertTrue(merged.merged());
        assertEquals("x+1", merged.task().id());
        assertEquals(List.of("src/a/X.java", "src/a/Y.java"), merged.task().resources());
        assertEquals(RiskTier.T2, merged.task().riskTier());
        assertTrue(merged.task().critical());
    }

    @Test
    @DisplayName("Non-critical work is deferred behind critical work")
    void defersNonCritical() {
        var plan = new BudgetPolicy(2).plan(List.of(
                task("n1", "docs/a/README.md", false),
                task("c1", "src/a/A.java", true),
                task("n2", "docs/b/GUIDE.md", false),
                task("c2", "src/b/B.java", true)), false);

        assertEquals(List.of(BudgetAction.Kind.DEFERRED), kinds(plan));
        assertEquals(2, plan.waves().size());
        assertTrue(plan.waves().get(0).stream().allMatch(WorkUnit::critical));
        assertEquals(List.of("n1", "n2"), plan.actions().get(0).taskIds());
    }

    @Test
    @DisplayName("Remaining overflow is split into sequential batches")
    void batches() {
        var tasks = new ArrayList<AgentTask>();
        for (int i = 0; i < 5; i++) {
            tasks.add(task("t" + i, "mod" + i + "/F.java", true));
        }
        var plan = new BudgetPolicy(2).plan(tasks, false);

        assertEquals(List.of(BudgetAction.Kind.BATCHED), kinds(plan));
        assertEquals(3, plan.waves().size());
        assertEquals(2, plan.maxWaveSize());
        assertEquals(5, plan.workerCount());
    }

    @Test
    @DisplayName("Conservation mode halves the ceiling")
    void conservationHalvesCeiling() {
        var policy = new BudgetPolicy(4);
        assertEquals(2, policy.effectiveCeiling(true));
        assertEquals(1, new BudgetPolicy(1).effectiveCeiling(true));

        var plan = policy.plan(List.of(task("a", "a/A.java", true), task("b", "b/B.java", true),
                task("c", "c/C.java", true)), true);
        assertEquals(2, plan.maxWaveSize());
        assertEquals(2, plan.waves().size());
    }

    @Test
    @DisplayName("A ceiling below one is rejected")
    void invalidCeiling() {
        assertThrows(IllegalArgumentException.class, () -> new BudgetPolicy(0));
    }

    @Test
    @DisplayName("No wave ever exceeds the ceiling and every task is scheduled exactly once")
    void neverExceedsCeiling() {
        var random = new Random(42);
        for (int round = 0; round < 200; round++) {
            int ceiling = 1 + random.nextInt(20);
            int count = 1 + random.nextInt(60);
            boolean conservation = random.nextBoolean();
            var tasks = new ArrayList<AgentTask>();
            for (int i = 0; i < count; i++) {
                String dir = "dir" + random.nextInt(15);
                tasks.add(task("t" + i, dir + "/F" + i + ".java", random.nextBoolean()));
            }
            var policy = new BudgetPolicy(ceiling);
            var plan = policy.plan(tasks, conservation);

            assertTrue(plan.maxWaveSize() <= policy.effectiveCeiling(conservation),
                    "round " + round + ": wave of " + plan.maxWaveSize() + " over ceiling " + ceiling);
            var scheduled = plan.waves().stream()
                    .flatMap(List::stream)
                    .flatMap(u -> u.memberIds().stream())
                    .sorted()
                    .toList();
            var expected = tasks.stream().map(AgentTask::id).sorted().toList();
            assertEquals(expected, scheduled, "round " + round);
        }
    }
}
