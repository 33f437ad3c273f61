package com.overseer.core.workflow;

import com.overseer.core.model.PhaseResult;
import com.overseer.core.model.PhaseStatus;
import com.overseer.core.model.StateTransition;
import com.overseer.core.model.WorkflowPlan;
import com.overseer.core.model.WorkflowStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable run-state of one request. Written only by the orchestrator thread through
 * {@link WorkflowStateMachine}; readers get copies.
 */
public class WorkflowInstance {

    private final String requestId;
    private final WorkflowPlan plan;
    private final String rollbackPlan;
    private final PhaseStatus[] phaseStatuses;
    private final int[] recoveryAttempts;
    private final Set<String> modifiedResources = new LinkedHashSet<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> incidents = new ArrayList<>();
    private final List<StateTransition> transitions = new ArrayList<>();
    private final Map<String, String> confirmations = new LinkedHashMap<>();
    private final Map<String, PhaseResult> phaseResults = new LinkedHashMap<>();
    private final List<PhaseCheckpoint> checkpoints = new ArrayList<>();

    private volatile WorkflowStatus status = WorkflowStatus.NOT_STARTED;
    private int currentIndex;
    private Instant startedAt;
    private Instant finishedAt;
    private PhaseResult pendingResult;
    private String heldWarning;
    private boolean submitHooksDone;
    private boolean stopHooksDone;

    public WorkflowInstance(String requestId, WorkflowPlan plan, String rollbackPlan) {
        this.requestId = requestId;
        this.plan = plan;
        this.rollbackPlan = rollbackPlan;
        this.phaseStatuses = new PhaseStatus[plan.size()];
        Arrays.fill(phaseStatuses, PhaseStatus.PENDING);
        this.recoveryAttempts = new int[plan.size()];
    }

    public String requestId() {
        return requestId;
    }

    public WorkflowPlan plan() {
        return plan;
    }

    public String rollbackPlan() {
        return rollbackPlan;
    }

    public WorkflowStatus status() {
        return status;
    }

    void status(WorkflowStatus newStatus) {
        this.status = newStatus;
    }

    public synchronized int currentIndex() {
        return currentIndex;
    }

    synchronized void currentIndex(int index) {
        this.currentIndex = index;
    }

    public synchronized PhaseStatus phaseStatus(int index) {
        return phaseStatuses[index];
    }

    synchronized void phaseStatus(int index, PhaseStatus newStatus) {
        phaseStatuses[index] = newStatus;
    }

    /**
     * Phase name to status, in plan order.
     */
    public synchronized Map<String, PhaseStatus> phaseStatuses() {
        var map = new LinkedHashMap<String, PhaseStatus>();
        for (int i = 0; i < phaseStatuses.length; i++) {
            map.put(plan.phase(i).name(), phaseStatuses[i]);
        }
        return map;
    }

    public synchronized int recoveryAttempts(int index) {
        return recoveryAttempts[index];
    }

    synchronized int incrementRecoveryAttempts(int index) {
        return ++recoveryAttempts[index];
    }

    public synchronized List<String> modifiedResources() {
        return List.copyOf(modifiedResources);
    }

    public synchronized void addModifiedResources(List<String> resources) {
        modifiedResources.addAll(resources);
    }

    public synchronized List<String> errors() {
        return List.copyOf(errors);
    }

    public synchronized void addError(String error) {
        errors.add(error);
    }

    public synchronized List<String> warnings() {
        return List.copyOf(warnings);
    }

    public synchronized void addWarning(String warning) {
        warnings.add(warning);
    }

    public synchronized List<String> incidents() {
        return List.copyOf(incidents);
    }

    public synchronized void addIncident(String incident) {
        incidents.add(incident);
    }

    public synchronized List<StateTransition> transitions() {
        return List.copyOf(transitions);
    }

    synchronized void addTransition(StateTransition transition) {
        transitions.add(transition);
    }

    public synchronized Map<String, String> confirmations() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(confirmations));
    }

    synchronized void addConfirmation(String phase, String operator) {
        confirmations.put(phase, operator);
    }

    public synchronized boolean isConfirmed(String phase) {
        return confirmations.containsKey(phase);
    }

    public synchronized Map<String, PhaseResult> phaseResults() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(phaseResults));
    }

    synchronized void putPhaseResult(PhaseResult result) {
        phaseResults.put(result.phase(), result);
    }

    public synchronized List<PhaseCheckpoint> checkpoints() {
        return List.copyOf(checkpoints);
    }

    synchronized void addCheckpoint(PhaseCheckpoint checkpoint) {
        checkpoints.add(checkpoint);
    }

    synchronized PhaseResult pendingResult() {
        return pendingResult;
    }

    synchronized void pendingResult(PhaseResult result) {
        this.pendingResult = result;
    }

    public synchronized String heldWarning() {
        return heldWarning;
    }

    synchronized void heldWarning(String warning) {
        this.heldWarning = warning;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    synchronized void startedAt(Instant at) {
        this.startedAt = at;
    }

    synchronized void finishedAt(Instant at) {
        this.finishedAt = at;
    }

    public synchronized Duration elapsed() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt != null ? finishedAt : Instant.now());
    }

    public synchronized boolean submitHooksDone() {
        return submitHooksDone;
    }

    public synchronized void markSubmitHooksDone() {
        this.submitHooksDone = true;
    }

    public synchronized boolean stopHooksDone() {
        return stopHooksDone;
    }

    public synchronized void markStopHooksDone() {
        this.stopHooksDone = true;
    }

    public synchronized long inProgressCount() {
        return Arrays.stream(phaseStatuses).filter(s -> s == PhaseStatus.IN_PROGRESS).count();
    }
}
