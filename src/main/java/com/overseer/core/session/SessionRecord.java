package com.overseer.core.session;

import com.overseer.core.model.ClassificationResult;
import com.overseer.core.model.Request;
import com.overseer.core.model.StateTransition;
import com.overseer.core.model.WorkflowStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Session-scoped history of one request: its score and plan, risk decisions, and every
 * recorded transition. Created on submit, appended on transition.
 */
public class SessionRecord {

    private final String requestId;
    private final Request request;
    private final Instant createdAt;
    private final List<String> riskDecisions = new ArrayList<>();
    private final List<StateTransition> transitions = new ArrayList<>();
    private ClassificationResult classification;
    private WorkflowStatus finalStatus;

    public SessionRecord(String requestId, Request request) {
        this.requestId = requestId;
        this.request = request;
        this.createdAt = Instant.now();
    }

    public String requestId() {
        return requestId;
    }

    public Request request() {
        return request;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized ClassificationResult classification() {
        return classification;
    }

    public synchronized void recordClassification(ClassificationResult result) {
        this.classification = result;
    }

    public synchronized void recordRiskDecision(String decision) {
        riskDecisions.add(decision);
    }

    public synchronized List<String> riskDecisions() {
        return List.copyOf(riskDecisions);
    }

    public synchronized void appendTransition(StateTransition transition) {
        transitions.add(transition);
    }

    public synchronized List<StateTransition> transitions() {
        return List.copyOf(transitions);
    }

    public synchronized WorkflowStatus finalStatus() {
        return finalStatus;
    }

    public synchronized void recordFinalStatus(WorkflowStatus status) {
        this.finalStatus = status;
    }
}
