package com.overseer.core.engine;

import com.overseer.core.events.EventBus;
import com.overseer.core.events.OverseerEvent;
import com.overseer.core.graph.OrchestrationGraph;
import com.overseer.core.logging.MdcContext;
import com.overseer.core.model.Request;
import com.overseer.core.model.WorkflowReport;
import com.overseer.core.model.WorkflowStatus;
import com.overseer.core.workflow.WorkflowStateMachine;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the engine: submits requests to the orchestration graph, resumes workflows
 * after a human confirmation and reports their state.
 * <p>
 * Calls for the same workflow are serialized; different workflows run independently.
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private static final AtomicInteger REQUEST_COUNTER = new AtomicInteger(0);

    private final OrchestrationGraph graph;
    private final WorkflowRegistry registry;
    private final EventBus eventBus;

    public Orchestrator(OrchestrationGraph graph, WorkflowRegistry registry, EventBus eventBus) {
        this.graph = graph;
        this.registry = registry;
        this.eventBus = eventBus;
    }

    /**
     * Runs a request until it finishes or parks waiting for a confirmation.
     */
    public WorkflowReport run(Request request) {
        return run(generateRequestId(), request);
    }

    /**
     * Runs a request under a pre-generated id (e.g. from the REST controller).
     *
     * @throws IllegalArgumentException if a workflow with this id already exists
     */
    public WorkflowReport run(String requestId, Request request) {
        WorkflowRuntime runtime = registry.register(requestId, request);
        log.info("Submitted workflow {}: {}", requestId, abbreviate(request.description()));
        eventBus.publish(OverseerEvent.of("workflow.submitted", requestId, null, Map.of(
                "request", request.description(),
                "fileHints", request.fileHints())));
        return invoke(runtime);
    }

    /**
     * Records a human confirmation for the phase awaiting one and continues the workflow.
     *
     * @throws java.util.NoSuchElementException if the workflow is unknown
     * @throws IllegalStateException if the workflow is not awaiting confirmation
     */
    public WorkflowReport confirm(String requestId, String operator) {
        WorkflowRuntime runtime = registry.require(requestId);
        synchronized (runtime) {
            WorkflowStateMachine machine = requireMachine(runtime);
            machine.confirm(operator);
            log.info("Workflow {} confirmed by {}", requestId, operator);
            eventBus.publish(OverseerEvent.of("workflow.confirmed", requestId, null,
                    Map.of("operator", operator != null ? operator : "operator")));
            return invoke(runtime);
        }
    }

    /**
     * Releases a completion held by a blocking stop hook.
     */
    public WorkflowReport acknowledge(String requestId, String operator) {
        WorkflowRuntime runtime = registry.require(requestId);
        synchronized (runtime) {
            requireMachine(runtime).acknowledge(operator);
            runtime.record().recordFinalStatus(runtime.status());
            eventBus.publish(OverseerEvent.of("workflow.acknowledged", requestId, null,
                    Map.of("operator", operator != null ? operator : "operator")));
            return runtime.report();
        }
    }

    public Optional<WorkflowReport> report(String requestId) {
        return registry.find(requestId).map(WorkflowRuntime::report);
    }

    public List<WorkflowReport> reports() {
        return registry.all().stream()
                .sorted(Comparator.comparing(r -> r.record().createdAt()))
                .map(WorkflowRuntime::report)
                .toList();
    }

    /**
     * Generates a unique request ID in the format OVSR-YYYY-NNNN.
     */
    public String generateRequestId() {
        int count = REQUEST_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("OVSR-%d-%04d", year, count);
    }

    private WorkflowReport invoke(WorkflowRuntime runtime) {
        String requestId = runtime.requestId();
        synchronized (runtime) {
            MdcContext.setRequest(requestId);
            try {
                var config = RunnableConfig.builder()
                        .threadId(requestId)
                        .build();
                Map<String, Object> input = Map.of("requestId", requestId);
                graph.getCompiledGraph().invoke(input, config)
                        .orElseThrow(() -> new IllegalStateException(
                                "Graph execution returned empty state for workflow " + requestId));
            } catch (RuntimeException e) {
                log.error("Workflow {} failed unexpectedly: {}", requestId, e.getMessage(), e);
                abortAfterError(runtime, e);
            } finally {
                MdcContext.clear();
            }
            return runtime.report();
        }
    }

    private void abortAfterError(WorkflowRuntime runtime, RuntimeException e) {
        WorkflowStateMachine machine = runtime.stateMachine();
        if (machine == null || machine.instance().status().isTerminal()) {
            throw e;
        }
        machine.abort("internal error: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        runtime.record().recordFinalStatus(WorkflowStatus.ABORTED_FAILED);
        eventBus.publish(OverseerEvent.of("workflow.failed", runtime.requestId(), null,
                Map.of("status", WorkflowStatus.ABORTED_FAILED.name())));
    }

    private static WorkflowStateMachine requireMachine(WorkflowRuntime runtime) {
        if (runtime.stateMachine() == null) {
            throw new IllegalStateException("Workflow " + runtime.requestId() + " has not been classified");
        }
        return runtime.stateMachine();
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 77) + "...";
    }
}
