package com.overseer.core.nodes;

import com.overseer.core.engine.WorkflowRegistry;
import com.overseer.core.engine.WorkflowRuntime;
import com.overseer.core.events.EventBus;
import com.overseer.core.events.OverseerEvent;
import com.overseer.core.hooks.HookAttributes;
import com.overseer.core.hooks.HookContext;
import com.overseer.core.hooks.HookDispatcher;
import com.overseer.core.hooks.HookPayload;
import com.overseer.core.hooks.HookResult;
import com.overseer.core.hooks.LifecyclePoint;
import com.overseer.core.logging.MdcContext;
import com.overseer.core.model.AgentTask;
import com.overseer.core.model.BudgetAction;
import com.overseer.core.model.Phase;
import com.overseer.core.model.PhaseResult;
import com.overseer.core.model.RiskTier;
import com.overseer.core.model.TaskDescriptor;
import com.overseer.core.model.TaskStatus;
import com.overseer.core.model.VerificationVerdict;
import com.overseer.core.model.WorkflowStatus;
import com.overseer.core.risk.IncompleteRiskAssessmentException;
import com.overseer.core.risk.RiskClassifier;
import com.overseer.core.session.SessionStore;
import com.overseer.core.state.OrchestrationState;
import com.overseer.core.swarm.AgentSwarmCoordinator;
import com.overseer.core.swarm.PhaseObserver;
import com.overseer.core.swarm.PlanningException;
import com.overseer.core.swarm.TaskDecomposer;
import com.overseer.core.workflow.WorkflowInstance;
import com.overseer.core.workflow.WorkflowStateMachine;
import com.overseer.core.workflow.WorkflowStateMachine.Advance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the current phase: decompose into tasks, gate each task's risk, run the swarm and apply
 * the result to the state machine, including targeted-fix recovery and escalation.
 * Does nothing unless the workflow is RUNNING.
 */
@Component
public class ExecutePhaseNode {

    private static final Logger log = LoggerFactory.getLogger(ExecutePhaseNode.class);

    private final WorkflowRegistry registry;
    private final TaskDecomposer decomposer;
    private final RiskClassifier riskClassifier;
    private final AgentSwarmCoordinator swarm;
    private final HookDispatcher hooks;
    private final SessionStore sessions;
    private final EventBus eventBus;

    public ExecutePhaseNode(WorkflowRegistry registry, TaskDecomposer decomposer, RiskClassifier riskClassifier,
                            AgentSwarmCoordinator swarm, HookDispatcher hooks, SessionStore sessions,
                            EventBus eventBus) {
        this.registry = registry;
        this.decomposer = decomposer;
        this.riskClassifier = riskClassifier;
        this.swarm = swarm;
        this.hooks = hooks;
        this.sessions = sessions;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(OrchestrationState state) {
        WorkflowRuntime runtime = registry.require(state.requestId());
        WorkflowStateMachine machine = runtime.stateMachine();
        WorkflowInstance instance = machine.instance();
        if (instance.status() != WorkflowStatus.RUNNING) {
            return update(instance);
        }

        Phase phase = machine.currentPhase();
        MdcContext.setPhase(runtime.requestId(), phase.name());
        try {
            runPhase(runtime, machine, phase);
        } finally {
            MdcContext.clearPhase();
        }
        return update(instance);
    }

    private void runPhase(WorkflowRuntime runtime, WorkflowStateMachine machine, Phase phase) {
        String requestId = runtime.requestId();
        WorkflowInstance instance = machine.instance();
        log.info("Starting phase '{}' ({}, verification {})", phase.name(), phase.ownership(), phase.verification());
        eventBus.publish(OverseerEvent.of("phase.started", requestId, null, Map.of(
                "phase", phase.name(),
                "index", instance.currentIndex(),
                "verification", phase.verification().name())));

        List<AgentTask> tasks = gate(runtime, phase, decomposer.decompose(phase, runtime.request()));
        var blockedCritical = tasks.stream()
                .filter(t -> t.status() == TaskStatus.BLOCKED && t.critical())
                .map(AgentTask::id)
                .toList();
        if (!blockedCritical.isEmpty()) {
            machine.failPhase("risk assessment incomplete for critical task(s) " + blockedCritical);
            machine.abort("critical task(s) " + blockedCritical + " blocked by incomplete risk assessment");
            publishPhaseEnd(requestId, phase, instance);
            return;
        }

        var observer = new PhaseProgress(runtime, phase);
        PhaseResult result;
        try {
            result = swarm.runPhase(requestId, phase, tasks, runtime.pressure(), observer);
        } catch (PlanningException e) {
            machine.failPhase("planning error: " + e.getMessage());
            machine.abort("planning error in phase '" + phase.name() + "'");
            publishPhaseEnd(requestId, phase, instance);
            return;
        }

        Advance advance = machine.completePhase(result);
        while (advance == Advance.VERIFICATION_UNSATISFIED) {
            List<String> failing = result.failingTaskIds();
            if (failing.isEmpty()) {
                machine.abort("verification " + phase.verification() + " of phase '" + phase.name()
                        + "' unsatisfied without failing tasks (rollback plan missing?)");
                break;
            }
            if (result.escalated().isEmpty() && machine.canRecover()) {
                machine.beginTargetedFix(failing);
                result = swarm.runTargetedFix(requestId, phase, result, runtime.failures(),
                        runtime.pressure(), observer);
                advance = machine.completePhase(result);
            } else {
                advance = machine.escalate(result);
                break;
            }
        }
        if (instance.status() == WorkflowStatus.ABORTED_FAILED) {
            for (String taskId : result.failingTaskIds()) {
                var outcome = result.outcome(taskId);
                String detail = outcome.verdict() != null ? outcome.verdict().detail() : outcome.error();
                instance.addError(taskId + ": " + (detail != null ? detail : "failed"));
            }
        }
        publishPhaseEnd(requestId, phase, instance);
    }

    /**
     * Classifies every task against the session ledger, never below the request's tier.
     * Tasks missing risk answers are marked BLOCKED instead of running.
     */
    private List<AgentTask> gate(WorkflowRuntime runtime, Phase phase, List<AgentTask> tasks) {
        RiskTier floor = runtime.classification().tier();
        var ledger = sessions.state().riskLedger();
        var gated = new ArrayList<AgentTask>(tasks.size());
        for (AgentTask task : tasks) {
            var descriptor = TaskDescriptor.of(task, runtime.request().riskAnswers());
            try {
                RiskTier tier = riskClassifier.classify(descriptor, ledger, floor);
                runtime.record().recordRiskDecision(task.id() + ": " + tier);
                gated.add(task.withRiskTier(tier));
            } catch (IncompleteRiskAssessmentException e) {
                runtime.record().recordRiskDecision(task.id() + ": " + e.getTier() + " blocked, missing "
                        + e.getMissingFields());
                gated.add(task.withRiskTier(e.getTier()).withStatus(TaskStatus.BLOCKED));
                if (!task.critical()) {
                    runtime.instance().addWarning(phase.name() + ": non-critical task " + task.id()
                            + " skipped, risk answers missing " + e.getMissingFields());
                }
                eventBus.publish(OverseerEvent.of("task.blocked", runtime.requestId(), task.id(), Map.of(
                        "tier", e.getTier().name(),
                        "missing", e.getMissingFields())));
            }
        }
        return gated;
    }

    private void publishPhaseEnd(String requestId, Phase phase, WorkflowInstance instance) {
        int index = instance.plan().phases().indexOf(phase);
        if (index < 0) {
            return;
        }
        eventBus.publish(OverseerEvent.of("phase.completed", requestId, null, Map.of(
                "phase", phase.name(),
                "phaseStatus", instance.phaseStatus(index).name(),
                "workflowStatus", instance.status().name())));
    }

    private static Map<String, Object> update(WorkflowInstance instance) {
        var updates = new HashMap<String, Object>();
        updates.put("status", instance.status().name());
        updates.put("phaseIndex", instance.currentIndex());
        return updates;
    }

    /**
     * Turns swarm callbacks into incidents, events and ON_RESOURCE_MUTATED hook dispatches.
     * Runs on the orchestrator thread.
     */
    private class PhaseProgress implements PhaseObserver {

        private final WorkflowRuntime runtime;
        private final Phase phase;
        private final WorkflowInstance instance;

        PhaseProgress(WorkflowRuntime runtime, Phase phase) {
            this.runtime = runtime;
            this.phase = phase;
            this.instance = runtime.instance();
        }

        @Override
        public void onWorkerSpawned(AgentTask task, String workerId) {
            eventBus.publish(OverseerEvent.of("worker.spawned", runtime.requestId(), task.id(),
                    Map.of("workerId", workerId, "phase", phase.name())));
        }

        @Override
        public void onWorkerStalled(AgentTask task, String workerId, String replacementId) {
            instance.addIncident(replacementId != null
                    ? phase.name() + ": worker " + workerId + " stalled, replaced by " + replacementId
                    : phase.name() + ": worker " + workerId + " stalled after replacement, task " + task.id() + " failed");
            var payload = new HashMap<String, Object>();
            payload.put("workerId", workerId);
            if (replacementId != null) {
                payload.put("replacementId", replacementId);
            }
            eventBus.publish(OverseerEvent.of("worker.stalled", runtime.requestId(), task.id(), payload));
        }

        @Override
        public void onResourcesMutated(AgentTask task, String workerId, List<String> resources) {
            var context = new HookContext(LifecyclePoint.ON_RESOURCE_MUTATED, runtime.requestId(), Map.of(
                    HookAttributes.PHASE, phase.name(),
                    HookAttributes.TASK_ID, task.id(),
                    HookAttributes.WORKER_ID, workerId,
                    HookAttributes.RESOURCES, String.join(",", resources)),
                    sessions.state());
            List<HookResult> results = hooks.dispatch(LifecyclePoint.ON_RESOURCE_MUTATED, context);
            HookOutcomes.record(instance, results);
            for (HookResult result : results) {
                if (result.payload() instanceof HookPayload.MutationReport report) {
                    report.findings().forEach(f -> instance.addWarning(task.id() + ": " + f));
                }
            }
            eventBus.publish(OverseerEvent.of("resources.mutated", runtime.requestId(), task.id(),
                    Map.of("workerId", workerId, "resources", resources)));
        }

        @Override
        public void onVerificationFailed(AgentTask task, VerificationVerdict verdict) {
            eventBus.publish(OverseerEvent.of("verification.failed", runtime.requestId(), task.id(),
                    Map.of("detail", verdict.detail(), "checks", verdict.failingChecks())));
        }

        @Override
        public void onTargetedFix(AgentTask task, String fixWorkerId, boolean resolved) {
            instance.addIncident(phase.name() + ": targeted fix " + fixWorkerId
                    + (resolved ? " resolved " : " did not resolve ") + task.id());
            eventBus.publish(OverseerEvent.of("task.fixed", runtime.requestId(), task.id(),
                    Map.of("workerId", fixWorkerId, "resolved", resolved)));
        }

        @Override
        public void onBudgetAction(BudgetAction action) {
            instance.addIncident(phase.name() + ": budget " + action.kind() + " - " + action.detail());
            eventBus.publish(OverseerEvent.of("budget.reduced", runtime.requestId(), null,
                    Map.of("kind", action.kind().name(), "detail", action.detail(), "tasks", action.taskIds())));
        }

        @Override
        public void onConservationEntered(String reason) {
            instance.addIncident(phase.name() + ": conservation mode entered, " + reason);
            eventBus.publish(OverseerEvent.of("conservation.entered", runtime.requestId(), null,
                    Map.of("reason", reason)));
        }
    }
}
