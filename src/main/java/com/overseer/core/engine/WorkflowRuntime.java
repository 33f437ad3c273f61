package com.overseer.core.engine;

import com.overseer.core.model.ClassificationResult;
import com.overseer.core.model.Request;
import com.overseer.core.model.WorkflowReport;
import com.overseer.core.model.WorkflowStatus;
import com.overseer.core.session.SessionRecord;
import com.overseer.core.swarm.ContextPressureMonitor;
import com.overseer.core.swarm.FailureTracker;
import com.overseer.core.workflow.WorkflowInstance;
import com.overseer.core.workflow.WorkflowStateMachine;

import java.util.List;
import java.util.Map;

/**
 * Everything the graph nodes need about one workflow that does not fit in the graph state:
 * the request, its classification, the state machine and per-workflow trackers.
 * The graph state itself only carries the request id, status and phase index.
 */
public class WorkflowRuntime {

    private final String requestId;
    private final Request request;
    private final SessionRecord record;
    private final ContextPressureMonitor pressure;
    private final FailureTracker failures = new FailureTracker();
    private volatile ClassificationResult classification;
    private volatile WorkflowStateMachine stateMachine;

    public WorkflowRuntime(String requestId, Request request, SessionRecord record,
                           ContextPressureMonitor pressure) {
        this.requestId = requestId;
        this.request = request;
        this.record = record;
        this.pressure = pressure;
    }

    public String requestId() {
        return requestId;
    }

    public Request request() {
        return request;
    }

    public SessionRecord record() {
        return record;
    }

    public ContextPressureMonitor pressure() {
        return pressure;
    }

    public FailureTracker failures() {
        return failures;
    }

    public ClassificationResult classification() {
        return classification;
    }

    public WorkflowStateMachine stateMachine() {
        return stateMachine;
    }

    public boolean classified() {
        return stateMachine != null;
    }

    void attach(ClassificationResult result, WorkflowStateMachine machine) {
        this.classification = result;
        this.stateMachine = machine;
    }

    public WorkflowInstance instance() {
        return stateMachine != null ? stateMachine.instance() : null;
    }

    public WorkflowStatus status() {
        WorkflowInstance instance = instance();
        return instance != null ? instance.status() : WorkflowStatus.NOT_STARTED;
    }

    public WorkflowReport report() {
        WorkflowInstance instance = instance();
        if (instance == null) {
            return new WorkflowReport(requestId, WorkflowStatus.NOT_STARTED, null, null, Map.of(),
                    List.of(), List.of(), List.of(), List.of(), 0L);
        }
        return new WorkflowReport(requestId, instance.status(),
                classification.workflowClass(), classification.tier(),
                instance.phaseStatuses(), instance.modifiedResources(),
                instance.errors(), instance.warnings(), instance.incidents(),
                instance.elapsed().toMillis());
    }
}
