package com.overseer.core.engine;

import com.overseer.core.model.ClassificationResult;
import com.overseer.core.model.Request;
import com.overseer.core.session.SessionStore;
import com.overseer.core.swarm.AgentSwarmCoordinator;
import com.overseer.core.workflow.WorkflowStateMachine;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of live workflows keyed by request id.
 */
@Component
public class WorkflowRegistry {

    private final ConcurrentHashMap<String, WorkflowRuntime> runtimes = new ConcurrentHashMap<>();
    private final SessionStore sessions;
    private final AgentSwarmCoordinator swarm;

    public WorkflowRegistry(SessionStore sessions, AgentSwarmCoordinator swarm) {
        this.sessions = sessions;
        this.swarm = swarm;
    }

    public WorkflowRuntime register(String requestId, Request request) {
        var runtime = new WorkflowRuntime(requestId, request, sessions.create(requestId, request),
                swarm.newPressureMonitor());
        if (runtimes.putIfAbsent(requestId, runtime) != null) {
            throw new IllegalArgumentException("Workflow " + requestId + " already exists");
        }
        return runtime;
    }

    public Optional<WorkflowRuntime> find(String requestId) {
        return Optional.ofNullable(runtimes.get(requestId));
    }

    public WorkflowRuntime require(String requestId) {
        return find(requestId).orElseThrow(() -> new NoSuchElementException("Unknown workflow " + requestId));
    }

    public Collection<WorkflowRuntime> all() {
        return List.copyOf(runtimes.values());
    }

    public void attach(WorkflowRuntime runtime, ClassificationResult result, WorkflowStateMachine machine) {
        runtime.attach(result, machine);
    }
}
