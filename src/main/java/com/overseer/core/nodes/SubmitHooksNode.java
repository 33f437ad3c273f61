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
import com.overseer.core.session.SessionStore;
import com.overseer.core.state.OrchestrationState;
import com.overseer.core.workflow.WorkflowInstance;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Runs ON_REQUEST_SUBMIT hooks once per workflow, then starts the first phase.
 */
@Component
public class SubmitHooksNode {

    private final HookDispatcher dispatcher;
    private final WorkflowRegistry registry;
    private final SessionStore sessions;
    private final EventBus eventBus;

    public SubmitHooksNode(HookDispatcher dispatcher, WorkflowRegistry registry,
                           SessionStore sessions, EventBus eventBus) {
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.sessions = sessions;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(OrchestrationState state) {
        WorkflowRuntime runtime = registry.require(state.requestId());
        WorkflowInstance instance = runtime.instance();
        if (instance.submitHooksDone()) {
            return Map.of("status", instance.status().name(), "phaseIndex", instance.currentIndex());
        }

        var context = new HookContext(LifecyclePoint.ON_REQUEST_SUBMIT, runtime.requestId(), Map.of(
                HookAttributes.REQUEST, runtime.request().description(),
                HookAttributes.FILE_HINTS, String.join(",", runtime.request().fileHints()),
                HookAttributes.WORKFLOW_CLASS, runtime.classification().workflowClass().name(),
                HookAttributes.TIER, runtime.classification().tier().name()),
                sessions.state());
        List<HookResult> results = dispatcher.dispatch(LifecyclePoint.ON_REQUEST_SUBMIT, context);
        HookOutcomes.record(instance, results);
        for (HookResult result : results) {
            if (result.payload() instanceof HookPayload.SubmitAdvice advice && !advice.advice().isEmpty()) {
                eventBus.publish(OverseerEvent.of("hook.advice", runtime.requestId(), null, Map.of(
                        "hook", result.hookName(), "advice", advice.advice())));
            }
        }
        instance.markSubmitHooksDone();

        runtime.stateMachine().start();
        return Map.of("status", instance.status().name(), "phaseIndex", instance.currentIndex());
    }
}
