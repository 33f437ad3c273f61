package com.overseer.core.swarm;

import com.overseer.core.model.AgentTask;
import com.overseer.core.model.BudgetAction;
import com.overseer.core.model.VerificationVerdict;

import java.util.List;

/**
 * Callbacks from a running phase. All methods are invoked on the thread that called
 * {@link AgentSwarmCoordinator#runPhase}, never on a worker thread.
 */
public interface PhaseObserver {

    PhaseObserver NONE = new PhaseObserver() { };

    default void onWorkerSpawned(AgentTask task, String workerId) { }

    default void onWorkerStalled(AgentTask task, String workerId, String replacementId) { }

    default void onResourcesMutated(AgentTask task, String workerId, List<String> resources) { }

    default void onVerificationFailed(AgentTask task, VerificationVerdict verdict) { }

    default void onTargetedFix(AgentTask task, String fixWorkerId, boolean resolved) { }

    default void onBudgetAction(BudgetAction action) { }

    default void onConservationEntered(String reason) { }
}
