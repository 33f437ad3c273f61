package com.overseer.core.workflow;

import com.overseer.core.model.AgentTask;
import com.overseer.core.model.OwnershipModel;
import com.overseer.core.model.Phase;
import com.overseer.core.model.PhaseResult;
import com.overseer.core.model.PhaseStatus;
import com.overseer.core.model.RiskTier;
import com.overseer.core.model.StateTransition;
import com.overseer.core.model.TaskOutcome;
import com.overseer.core.model.TaskStatus;
import com.overseer.core.model.VerificationLevel;
import com.overseer.core.model.VerificationVerdict;
import com.overseer.core.model.WorkflowClass;
import com.overseer.core.model.WorkflowPlan;
import com.overseer.core.model.WorkflowStatus;
import com.overseer.core.workflow.WorkflowStateMachine.Advance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowStateMachineTest {

    private final List<StateTransition> seen = new ArrayList<>();

    private WorkflowStateMachine machine(String rollback, Phase... phases) {
        var plan = new WorkflowPlan(WorkflowClass.STANDARD, RiskTier.T1, List.of(phases), false);
        return new WorkflowStateMachine(new WorkflowInstance("OVSR-TEST-0001", plan, rollback), 2, seen::add);
    }

    private static Phase phase(String name, VerificationLevel level) {
        return new Phase(name, OwnershipModel.PARALLEL_SWARM, level, false);
    }

    private static AgentTask task(String id, boolean critical, RiskTier tier) {
        return AgentTask.pending(id, "implement", "work on " + id, List.of("src/" + id + ".java"), critical)
                .withRiskTier(tier);
    }

    private static TaskOutcome passed(String id) {
        return new TaskOutcome(id, TaskStatus.COMPLETED, "w-" + id, List.of("src/" + id + ".java"), "ok", null,
                VerificationVerdict.pass("ok"), 0);
    }

    private static TaskOutcome failed(String id, String... checks) {
        return new TaskOutcome(id, TaskStatus.COMPLETED, "w-" + id, List.of("src/" + id + ".java"), "done", null,
                VerificationVerdict.fail("check failed", List.of(checks)), 0);
    }

    private static PhaseResult result(String phase, List<AgentTask> tasks, TaskOutcome... outcomes) {
        var map = new LinkedHashMap<String, TaskOutcome>();
        for (TaskOutcome outcome : outcomes) {
            map.put(outcome.taskId(), outcome);
        }
        return new PhaseResult(phase, tasks, map, List.of(), List.of(), List.of(), List.of(), false, 10L);
    }

    @Test
    @DisplayName("Phases complete strictly in order and the workflow ends ALL_PHASES_COMPLETED")
    void happyPath() {
        var sm = machine(null, phase("plan", VerificationLevel.NONE), phase("implement", VerificationLevel.BASIC));
        sm.start();
        assertEquals(PhaseStatus.IN_PROGRESS, sm.instance().phaseStatus(0));
        assertEquals(PhaseStatus.PENDING, sm.instance().phaseStatus(1));

        var a = task("a", true, RiskTier.T0);
        assertEquals(Advance.ADVANCED, sm.completePhase(result("plan", List.of(a), passed("a"))));
        assertEquals(PhaseStatus.COMPLETED, sm.instance().phaseStatus(0));
        assertEquals(PhaseStatus.IN_PROGRESS, sm.instance().phaseStatus(1));
        assertTrue(sm.invariantHolds());

        assertEquals(Advance.COMPLETED_ALL, sm.completePhase(result("implement", List.of(a), passed("a"))));
        assertEquals(WorkflowStatus.ALL_PHASES_COMPLETED, sm.instance().status());
        assertTrue(sm.invariantHolds());
        assertEquals(List.of("src/a.java"), sm.instance().modifiedResources());
        assertFalse(seen.isEmpty());
        assertEquals(sm.instance().transitions(), seen);
    }

    @Test
    @DisplayName("Completing a phase before start is rejected")
    void completeBeforeStart() {
        var sm = machine(null, phase("execute", VerificationLevel.NONE));
        assertThrows(IllegalStateException.class, () -> sm.completePhase(PhaseResult.empty("execute")));
    }

    @Nested
    @DisplayName("Verification levels")
    class Verification {

        @Test
        @DisplayName("BASIC ignores failing non-critical tasks")
        void basicIgnoresNonCritical() {
            var sm = machine(null, phase("implement", VerificationLevel.BASIC));
            sm.start();
            var tasks = List.of(task("a", true, RiskTier.T1), task("docs", false, RiskTier.T0));
            assertEquals(Advance.COMPLETED_ALL, sm.completePhase(result("implement", tasks, passed("a"), failed("docs"))));
            assertEquals(1, sm.instance().warnings().size());
            assertTrue(sm.instance().warnings().get(0).contains("[docs]"));
        }

        @Test
        @DisplayName("A failed worker fails the phase even without verification")
        void failedWorkerFailsUnverifiedPhase() {
            var sm = machine(null, phase("execute", VerificationLevel.NONE));
            sm.start();
            var tasks = List.of(task("a", false, RiskTier.T0));
            var crashed = new TaskOutcome("a", TaskStatus.FAILED, "w-a", List.of(), "", "disk full",
                    VerificationVerdict.fail("disk full", List.of()), 0);

            assertEquals(Advance.VERIFICATION_UNSATISFIED, sm.completePhase(result("execute", tasks, crashed)));
            assertEquals(PhaseStatus.FAILED, sm.instance().phaseStatus(0));
            assertEquals(WorkflowStatus.RUNNING, sm.instance().status());
        }

        @Test
        @DisplayName("FULL requires every executed task to pass")
        void fullRequiresAll() {
            var sm = machine(null, phase("implement", VerificationLevel.FULL));
            sm.start();
            var tasks = List.of(task("a", true, RiskTier.T2), task("docs", false, RiskTier.T0));
            assertEquals(Advance.VERIFICATION_UNSATISFIED,
                    sm.completePhase(result("implement", tasks, passed("a"), failed("docs"))));
            assertEquals(PhaseStatus.FAILED, sm.instance().phaseStatus(0));
            assertEquals(WorkflowStatus.RUNNING, sm.instance().status());
        }

        @Test
        @DisplayName("FULL_SECURITY_ROLLBACK needs a rollback plan")
        void rollbackRequired() {
            var tasks = List.of(task("a", true, RiskTier.T2));
            var without = machine(null, phase("implement", VerificationLevel.FULL_SECURITY_ROLLBACK));
            var with = machine("git revert", phase("implement", VerificationLevel.FULL_SECURITY_ROLLBACK));

            assertFalse(without.verificationSatisfied(VerificationLevel.FULL_SECURITY_ROLLBACK,
                    result("implement", tasks, passed("a"))));
            assertTrue(with.verificationSatisfied(VerificationLevel.FULL_SECURITY_ROLLBACK,
                    result("implement", tasks, passed("a"))));
        }

        @Test
        @DisplayName("FULL_SECURITY_ROLLBACK fails on a security check even if other checks pass")
        void securityCheckFails() {
            var sm = machine("git revert", phase("implement", VerificationLevel.FULL_SECURITY_ROLLBACK));
            var tasks = List.of(task("a", true, RiskTier.T2));
            assertFalse(sm.verificationSatisfied(VerificationLevel.FULL_SECURITY_ROLLBACK,
                    result("implement", tasks, failed("a", VerificationVerdict.SECURITY_CHECK))));
        }

        @Test
        @DisplayName("Skipped tasks do not count against verification")
        void skippedIgnored() {
            var sm = machine(null, phase("implement", VerificationLevel.FULL));
            var tasks = List.of(task("a", true, RiskTier.T0), task("b", false, RiskTier.T0));
            var skipped = new TaskOutcome("b", TaskStatus.SKIPPED, null, List.of(), "", null, null, 0);
            assertTrue(sm.verificationSatisfied(VerificationLevel.FULL, result("implement", tasks, passed("a"), skipped)));
        }
    }

    @Nested
    @DisplayName("Human confirmation")
    class Confirmation {

        @Test
        @DisplayName("A phase with a T3 task waits for confirmation, then advances")
        void t3NeedsConfirmation() {
            var sm = machine("git revert", phase("implement", VerificationLevel.FULL_SECURITY_ROLLBACK),
                    phase("verify", VerificationLevel.FULL_SECURITY_ROLLBACK));
            sm.start();
            var tasks = List.of(task("a", true, RiskTier.T3));

            assertEquals(Advance.AWAITING_CONFIRMATION, sm.completePhase(result("implement", tasks, passed("a"))));
            assertEquals(WorkflowStatus.AWAITING_CONFIRMATION, sm.instance().status());
            assertEquals(PhaseStatus.IN_PROGRESS, sm.instance().phaseStatus(0));

            assertEquals(Advance.ADVANCED, sm.confirm("alice"));
            assertEquals(PhaseStatus.COMPLETED, sm.instance().phaseStatus(0));
            assertEquals("alice", sm.instance().confirmations().get("implement"));
            assertEquals(WorkflowStatus.RUNNING, sm.instance().status());
        }

        @Test
        @DisplayName("Confirm without a pending confirmation is rejected")
        void confirmRejected() {
            var sm = machine(null, phase("execute", VerificationLevel.NONE));
            sm.start();
            assertThrows(IllegalStateException.class, () -> sm.confirm("bob"));
        }
    }

    @Nested
    @DisplayName("Recovery")
    class Recovery {

        @Test
        @DisplayName("Targeted fix re-opens the failed phase, bounded by the recovery limit")
        void boundedRecovery() {
            var sm = machine(null, phase("implement", VerificationLevel.FULL));
            sm.start();
            var tasks = List.of(task("a", true, RiskTier.T1));
            var failing = result("implement", tasks, failed("a"));

            sm.completePhase(failing);
            assertTrue(sm.canRecover());
            sm.beginTargetedFix(List.of("a"));
            assertEquals(PhaseStatus.IN_PROGRESS, sm.instance().phaseStatus(0));
            sm.completePhase(failing);
            sm.beginTargetedFix(List.of("a"));
            sm.completePhase(failing);

            assertFalse(sm.canRecover());
            assertThrows(IllegalStateException.class, () -> sm.beginTargetedFix(List.of("a")));
            assertEquals(2, sm.instance().recoveryAttempts(0));
        }

        @Test
        @DisplayName("Escalation drops non-critical failures and completes with a warning")
        void escalateReducedScope() {
            var sm = machine(null, phase("implement", VerificationLevel.FULL));
            sm.start();
            var tasks = List.of(task("a", true, RiskTier.T1), task("docs", false, RiskTier.T0));
            var failing = result("implement", tasks, passed("a"), failed("docs"));
            sm.completePhase(failing);

            assertEquals(Advance.COMPLETED_ALL, sm.escalate(failing));
            assertEquals(WorkflowStatus.ALL_PHASES_COMPLETED, sm.instance().status());
            assertTrue(sm.instance().warnings().get(0).contains("docs"));
        }

        @Test
        @DisplayName("Escalation with a critical failure aborts and skips pending phases")
        void escalateAborts() {
            var sm = machine(null, phase("implement", VerificationLevel.FULL), phase("verify", VerificationLevel.FULL));
            sm.start();
            var tasks = List.of(task("a", true, RiskTier.T1));
            var failing = result("implement", tasks, failed("a"));
            sm.completePhase(failing);

            sm.escalate(failing);

            assertEquals(WorkflowStatus.ABORTED_FAILED, sm.instance().status());
            assertEquals(PhaseStatus.FAILED, sm.instance().phaseStatus(0));
            assertEquals(PhaseStatus.SKIPPED, sm.instance().phaseStatus(1));
            assertTrue(sm.invariantHolds());
            assertFalse(sm.instance().errors().isEmpty());
        }

        @Test
        @DisplayName("Aborting twice is rejected")
        void abortTwice() {
            var sm = machine(null, phase("execute", VerificationLevel.NONE));
            sm.start();
            sm.abort("operator cancelled");
            assertThrows(IllegalStateException.class, () -> sm.abort("again"));
        }
    }

    @Test
    @DisplayName("A held completion is released by acknowledgement")
    void holdAndAcknowledge() {
        var sm = machine(null, phase("execute", VerificationLevel.NONE));
        sm.start();
        sm.completePhase(result("execute", List.of()));

        sm.holdCompletion("coverage gate failed");
        assertEquals(WorkflowStatus.COMPLETION_HELD, sm.instance().status());
        assertEquals("coverage gate failed", sm.instance().heldWarning());

        sm.acknowledge("carol");
        assertEquals(WorkflowStatus.ALL_PHASES_COMPLETED, sm.instance().status());
        assertNull(sm.instance().heldWarning());
    }

    @Test
    @DisplayName("Checkpoints are recorded after phases that request them")
    void checkpoints() {
        var sm = machine(null, new Phase("analyze", OwnershipModel.SINGLE_AGENT, VerificationLevel.NONE, true),
                phase("implement", VerificationLevel.NONE));
        sm.start();
        sm.completePhase(result("analyze", List.of()));
        sm.completePhase(result("implement", List.of()));

        assertEquals(1, sm.instance().checkpoints().size());
        assertEquals("analyze", sm.instance().checkpoints().get(0).phase());
    }
}
