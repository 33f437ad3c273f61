package com.overseer.core.nodes;

import com.overseer.core.engine.WorkflowRegistry;
import com.overseer.core.engine.WorkflowRuntime;
import com.overseer.core.events.EventBus;
import com.overseer.core.events.OverseerEvent;
import com.overseer.core.hooks.HookAttributes;
import com.overseer.core.hooks.HookContext;
import com.overseer.core.hooks.HookDispatcher;
import com.overseer.core.hooks.HookResult;
import com.overseer.core.hooks.LifecyclePoint;
import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.model.WorkflowStatus;
import com.overseer.core.session.SessionStore;
import com.overseer.core.state.OrchestrationState;
import com.overseer.core.workflow.WorkflowInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Runs ON_WORKFLOW_STOP hooks once the workflow is terminal and records the final outcome.
 * A failing blocking hook holds an otherwise completed workflow until acknowledged.
 */
@Component
public class StopHooksNode {

    private static final Logger log = LoggerFactory.getLogger(StopHooksNode.class);

    private final HookDispatcher dispatcher;
    private final WorkflowRegistry registry;
    private final SessionStore sessions;
    private final EventBus eventBus;
    private final OverseerMetrics metrics;

    @Autowired
    public StopHooksNode(HookDispatcher dispatcher, WorkflowRegistry registry, SessionStore sessions,
                         EventBus eventBus, @Autowired(required = false) OverseerMetrics metrics) {
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.sessions = sessions;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(OrchestrationState state) {
        WorkflowRuntime runtime = registry.require(state.requestId());
        WorkflowInstance instance = runtime.instance();
        if (instance.stopHooksDone() || !instance.status().isTerminal()) {
            return Map.of("status", instance.status().name(), "phaseIndex", instance.currentIndex());
        }

        var context = new HookContext(LifecyclePoint.ON_WORKFLOW_STOP, runtime.requestId(), Map.of(
                HookAttributes.STATUS, instance.status().name(),
                HookAttributes.MODIFIED_COUNT, instance.modifiedResources().size(),
                HookAttributes.ERROR_COUNT, instance.errors().size(),
                HookAttributes.WARNING_COUNT, instance.warnings().size()),
                sessions.state());
        List<HookResult> results = dispatcher.dispatch(LifecyclePoint.ON_WORKFLOW_STOP, context);
        HookOutcomes.record(instance, results);
        instance.markStopHooksDone();

        var holding = results.stream().filter(HookResult::holdsCompletion).findFirst();
        if (holding.isPresent() && instance.status() == WorkflowStatus.ALL_PHASES_COMPLETED) {
            HookResult hook = holding.get();
            runtime.stateMachine().holdCompletion("completion held by stop hook '" + hook.hookName()
                    + "': " + (hook.error() != null ? hook.error() : hook.status().name()));
        }

        WorkflowStatus status = instance.status();
        runtime.record().recordFinalStatus(status);
        sessions.outcomes().record(runtime.classification().workflowClass(),
                status == WorkflowStatus.ALL_PHASES_COMPLETED);
        if (metrics != null) {
            metrics.recordWorkflowResult(status.name());
        }
        log.info("Workflow {} finished {} in {}ms ({} error(s), {} incident(s))", runtime.requestId(), status,
                instance.elapsed().toMillis(), instance.errors().size(), instance.incidents().size());
        eventBus.publish(OverseerEvent.of(status == WorkflowStatus.ABORTED_FAILED ? "workflow.failed" : "workflow.completed",
                runtime.requestId(), null, Map.of(
                        "status", status.name(),
                        "modifiedResources", instance.modifiedResources(),
                        "errors", instance.errors())));

        return Map.of("status", status.name(), "phaseIndex", instance.currentIndex());
    }
}
