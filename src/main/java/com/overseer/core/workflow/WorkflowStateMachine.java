package com.overseer.core.workflow;

import com.overseer.core.model.Phase;
import com.overseer.core.model.PhaseResult;
import com.overseer.core.model.PhaseStatus;
import com.overseer.core.model.RiskTier;
import com.overseer.core.model.StateTransition;
import com.overseer.core.model.TaskOutcome;
import com.overseer.core.model.TaskStatus;
import com.overseer.core.model.VerificationLevel;
import com.overseer.core.model.WorkflowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * Drives one {@link WorkflowInstance} through its phases.
 * <p>
 * Phases run strictly in plan order. A phase only becomes COMPLETED when its verification
 * requirement holds, and a phase containing a T3 task additionally needs a recorded human
 * confirmation. A failed phase re-enters IN_PROGRESS only through {@link #beginTargetedFix};
 * completed phases are never restarted. Every transition is reported to the listener.
 * <p>
 * Not thread-safe: only the orchestrator thread calls into a state machine.
 */
public class WorkflowStateMachine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowStateMachine.class);

    /** Outcome of {@link #completePhase} and {@link #confirm}. */
    public enum Advance {
        /** Phase completed, next phase is now in progress. */
        ADVANCED,
        /** Last phase completed. */
        COMPLETED_ALL,
        /** Verification holds but a T3 task is waiting for a human. */
        AWAITING_CONFIRMATION,
        /** Verification requirement not met; the phase is now FAILED. */
        VERIFICATION_UNSATISFIED
    }

    private final WorkflowInstance instance;
    private final int maxRecoveryAttempts;
    private final Consumer<StateTransition> listener;

    public WorkflowStateMachine(WorkflowInstance instance, int maxRecoveryAttempts,
                                Consumer<StateTransition> listener) {
        this.instance = instance;
        this.maxRecoveryAttempts = maxRecoveryAttempts;
        this.listener = listener != null ? listener : t -> { };
    }

    public WorkflowInstance instance() {
        return instance;
    }

    public void start() {
        requireStatus(WorkflowStatus.NOT_STARTED, "start");
        instance.startedAt(Instant.now());
        moveWorkflow(WorkflowStatus.RUNNING, "started");
        movePhase(0, PhaseStatus.IN_PROGRESS, "first phase");
    }

    public Phase currentPhase() {
        return instance.plan().phase(instance.currentIndex());
    }

    /**
     * Applies the result of the current phase.
     */
    public Advance completePhase(PhaseResult result) {
        requireStatus(WorkflowStatus.RUNNING, "completePhase");
        int index = instance.currentIndex();
        requirePhaseStatus(index, PhaseStatus.IN_PROGRESS, "completePhase");
        Phase phase = currentPhase();
        instance.putPhaseResult(result);
        instance.addModifiedResources(result.modifiedResources());

        if (!verificationSatisfied(phase.verification(), result)) {
            movePhase(index, PhaseStatus.FAILED,
                    "verification " + phase.verification() + " unsatisfied " + result.failingTaskIds());
            return Advance.VERIFICATION_UNSATISFIED;
        }
        List<String> accepted = result.failingTaskIds();
        if (!accepted.isEmpty()) {
            instance.addWarning(phase.name() + ": accepted non-critical tasks that failed verification " + accepted);
        }
        if (result.containsTier(RiskTier.T3) && !instance.isConfirmed(phase.name())) {
            instance.pendingResult(result);
            moveWorkflow(WorkflowStatus.AWAITING_CONFIRMATION,
                    "phase '" + phase.name() + "' contains a T3 task");
            return Advance.AWAITING_CONFIRMATION;
        }
        return advance(index, "verification " + phase.verification() + " satisfied");
    }

    /**
     * Records a human confirmation for the phase awaiting it and completes that phase.
     */
    public Advance confirm(String operator) {
        requireStatus(WorkflowStatus.AWAITING_CONFIRMATION, "confirm");
        int index = instance.currentIndex();
        String phase = currentPhase().name();
        String who = operator == null || operator.isBlank() ? "operator" : operator;
        instance.addConfirmation(phase, who);
        instance.pendingResult(null);
        moveWorkflow(WorkflowStatus.RUNNING, "confirmed by " + who);
        return advance(index, "confirmed by " + who);
    }

    public void failPhase(String reason) {
        requireStatus(WorkflowStatus.RUNNING, "failPhase");
        int index = instance.currentIndex();
        requirePhaseStatus(index, PhaseStatus.IN_PROGRESS, "failPhase");
        instance.addError(currentPhase().name() + ": " + reason);
        movePhase(index, PhaseStatus.FAILED, reason);
    }

    public boolean canRecover() {
        int index = instance.currentIndex();
        return instance.status() == WorkflowStatus.RUNNING
                && instance.phaseStatus(index) == PhaseStatus.FAILED
                && instance.recoveryAttempts(index) < maxRecoveryAttempts;
    }

    /**
     * Re-opens the failed current phase for a narrowly scoped fix of the given tasks.
     *
     * @throws IllegalStateException if the phase is not FAILED or its recovery attempts are used up
     */
    public void beginTargetedFix(List<String> taskIds) {
        requireStatus(WorkflowStatus.RUNNING, "beginTargetedFix");
        int index = instance.currentIndex();
        requirePhaseStatus(index, PhaseStatus.FAILED, "beginTargetedFix");
        if (instance.recoveryAttempts(index) >= maxRecoveryAttempts) {
            throw new IllegalStateException("Phase '" + currentPhase().name()
                    + "' exhausted its " + maxRecoveryAttempts + " recovery attempts");
        }
        int attempt = instance.incrementRecoveryAttempts(index);
        instance.addIncident(currentPhase().name() + ": targeted fix #" + attempt + " for " + taskIds);
        movePhase(index, PhaseStatus.IN_PROGRESS, "targeted fix #" + attempt + " " + taskIds);
    }

    /**
     * Handles a phase whose recovery did not succeed. If every unresolved task is non-critical
     * they are dropped and the phase completes with reduced scope; otherwise the workflow aborts.
     */
    public Advance escalate(PhaseResult result) {
        requireStatus(WorkflowStatus.RUNNING, "escalate");
        int index = instance.currentIndex();
        Phase phase = currentPhase();
        List<String> unresolved = result.failingTaskIds();
        boolean allNonCritical = !unresolved.isEmpty()
                && unresolved.stream().noneMatch(result::isCritical);

        if (allNonCritical) {
            if (instance.phaseStatus(index) == PhaseStatus.FAILED) {
                movePhase(index, PhaseStatus.IN_PROGRESS, "reduced-scope re-plan");
            }
            instance.addWarning(phase.name() + ": dropped non-critical tasks " + unresolved);
            Advance advance = completePhase(result.dropping(unresolved));
            if (advance != Advance.VERIFICATION_UNSATISFIED) {
                return advance;
            }
        }
        abort("phase '" + phase.name() + "' could not be recovered " + unresolved);
        return Advance.VERIFICATION_UNSATISFIED;
    }

    /**
     * Terminates the workflow. Remaining pending phases are skipped; results gathered so far
     * stay on the instance.
     */
    public void abort(String reason) {
        if (instance.status().isTerminal()) {
            throw new IllegalStateException("Cannot abort workflow in status " + instance.status());
        }
        int index = instance.currentIndex();
        if (instance.phaseStatus(index) == PhaseStatus.IN_PROGRESS) {
            movePhase(index, PhaseStatus.FAILED, reason);
        }
        for (int i = 0; i < instance.plan().size(); i++) {
            if (instance.phaseStatus(i) == PhaseStatus.PENDING) {
                movePhase(i, PhaseStatus.SKIPPED, "workflow aborted");
            }
        }
        instance.addError(reason);
        instance.pendingResult(null);
        instance.finishedAt(Instant.now());
        moveWorkflow(WorkflowStatus.ABORTED_FAILED, reason);
    }

    /**
     * A blocking stop hook refused completion.
     */
    public void holdCompletion(String warning) {
        requireStatus(WorkflowStatus.ALL_PHASES_COMPLETED, "holdCompletion");
        instance.heldWarning(warning);
        instance.addWarning(warning);
        moveWorkflow(WorkflowStatus.COMPLETION_HELD, warning);
    }

    public void acknowledge(String operator) {
        requireStatus(WorkflowStatus.COMPLETION_HELD, "acknowledge");
        String who = operator == null || operator.isBlank() ? "operator" : operator;
        instance.heldWarning(null);
        moveWorkflow(WorkflowStatus.ALL_PHASES_COMPLETED, "acknowledged by " + who);
    }

    /**
     * At most one phase is IN_PROGRESS, and none while the workflow is terminal.
     */
    public boolean invariantHolds() {
        long inProgress = instance.inProgressCount();
        WorkflowStatus status = instance.status();
        if (status.isTerminal() || status == WorkflowStatus.NOT_STARTED) {
            return inProgress == 0;
        }
        return inProgress <= 1;
    }

    /**
     * A worker that ended FAILED fails the phase at every level, NONE included. Above that,
     * BASIC checks critical tasks' verdicts, FULL every verdict, and FULL_SECURITY_ROLLBACK
     * additionally a clean security check and a rollback plan.
     */
    boolean verificationSatisfied(VerificationLevel level, PhaseResult result) {
        List<TaskOutcome> executed = result.outcomes().values().stream()
                .filter(TaskOutcome::executed)
                .toList();
        if (executed.stream().anyMatch(o -> o.status() == TaskStatus.FAILED)) {
            return false;
        }
        if (level == VerificationLevel.NONE) {
            return true;
        }
        if (level == VerificationLevel.BASIC) {
            return executed.stream()
                    .filter(o -> result.isCritical(o.taskId()))
                    .allMatch(TaskOutcome::passed);
        }
        boolean allPassed = executed.stream().allMatch(TaskOutcome::passed);
        if (level == VerificationLevel.FULL) {
            return allPassed;
        }
        boolean securityClean = executed.stream()
                .noneMatch(o -> o.verdict() != null && o.verdict().failsSecurity());
        String rollback = instance.rollbackPlan();
        return allPassed && securityClean && rollback != null && !rollback.isBlank();
    }

    private Advance advance(int index, String reason) {
        Phase phase = instance.plan().phase(index);
        movePhase(index, PhaseStatus.COMPLETED, reason);
        if (phase.checkpointAfter()) {
            PhaseResult result = instance.phaseResults().get(phase.name());
            instance.addCheckpoint(new PhaseCheckpoint(phase.name(), index,
                    instance.modifiedResources(),
                    result != null ? result.outcomes().size() + " task outcomes" : "no tasks",
                    Instant.now()));
        }
        int next = index + 1;
        if (next >= instance.plan().size()) {
            instance.finishedAt(Instant.now());
            moveWorkflow(WorkflowStatus.ALL_PHASES_COMPLETED, "all phases completed");
            return Advance.COMPLETED_ALL;
        }
        instance.currentIndex(next);
        movePhase(next, PhaseStatus.IN_PROGRESS, "previous phase completed");
        return Advance.ADVANCED;
    }

    private void movePhase(int index, PhaseStatus to, String reason) {
        PhaseStatus from = instance.phaseStatus(index);
        instance.phaseStatus(index, to);
        record(instance.plan().phase(index).name(), from.name(), to.name(), reason);
    }

    private void moveWorkflow(WorkflowStatus to, String reason) {
        WorkflowStatus from = instance.status();
        instance.status(to);
        record(StateTransition.WORKFLOW, from.name(), to.name(), reason);
    }

    private void record(String subject, String from, String to, String reason) {
        var transition = new StateTransition(subject, from, to, reason, Instant.now());
        instance.addTransition(transition);
        log.debug("[{}] {}: {} -> {} ({})", instance.requestId(), subject, from, to, reason);
        listener.accept(transition);
    }

    private void requireStatus(WorkflowStatus expected, String operation) {
        if (instance.status() != expected) {
            throw new IllegalStateException("Cannot " + operation + " while workflow is "
                    + instance.status() + " (expected " + expected + ")");
        }
    }

    private void requirePhaseStatus(int index, PhaseStatus expected, String operation) {
        PhaseStatus actual = instance.phaseStatus(index);
        if (actual != expected) {
            throw new IllegalStateException("Cannot " + operation + ": phase '"
                    + instance.plan().phase(index).name() + "' is " + actual + " (expected " + expected + ")");
        }
    }
}
