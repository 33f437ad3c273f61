package com.overseer.core.nodes;

import com.overseer.core.classifier.RequestClassifier;
import com.overseer.core.config.OverseerProperties;
import com.overseer.core.engine.WorkflowRegistry;
import com.overseer.core.engine.WorkflowRuntime;
import com.overseer.core.events.EventBus;
import com.overseer.core.events.OverseerEvent;
import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.model.ClassificationResult;
import com.overseer.core.model.Request;
import com.overseer.core.model.SessionContext;
import com.overseer.core.model.StateTransition;
import com.overseer.core.session.SessionStore;
import com.overseer.core.state.OrchestrationState;
import com.overseer.core.workflow.WorkflowInstance;
import com.overseer.core.workflow.WorkflowStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Scores the request, selects its plan and creates the workflow's state machine.
 * A workflow that is already classified passes through unchanged.
 * <p>
 * Patterns recorded earlier in the session are added to the request's prior patterns, and the
 * session's workflow outcomes weigh into the classifier's confidence.
 */
@Component
public class ClassifyRequestNode {

    private static final Logger log = LoggerFactory.getLogger(ClassifyRequestNode.class);

    private final RequestClassifier classifier;
    private final WorkflowRegistry registry;
    private final SessionStore sessions;
    private final EventBus eventBus;
    private final OverseerMetrics metrics;
    private final int maxRecoveryAttempts;

    @Autowired
    public ClassifyRequestNode(RequestClassifier classifier, WorkflowRegistry registry, SessionStore sessions,
                               EventBus eventBus, OverseerProperties properties,
                               @Autowired(required = false) OverseerMetrics metrics) {
        this.classifier = classifier;
        this.registry = registry;
        this.sessions = sessions;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxRecoveryAttempts = properties.getWorkflow().getMaxRecoveryAttempts();
    }

    public Map<String, Object> apply(OrchestrationState state) {
        WorkflowRuntime runtime = registry.require(state.requestId());
        if (runtime.classified()) {
            WorkflowInstance instance = runtime.instance();
            return Map.of("status", instance.status().name(), "phaseIndex", instance.currentIndex());
        }

        Request request = withSessionPatterns(runtime.request(), sessions.state().patterns());
        ClassificationResult result = classifier.classify(request, sessions.outcomes());
        runtime.record().recordClassification(result);
        String rollback = runtime.request().riskAnswers().fastestRollback();
        var instance = new WorkflowInstance(runtime.requestId(), result.plan(), rollback);
        var machine = new WorkflowStateMachine(instance, maxRecoveryAttempts,
                transition -> onTransition(runtime, transition));
        registry.attach(runtime, result, machine);

        if (metrics != null) {
            metrics.recordClassification(result.workflowClass().name(), result.tier().name());
        }
        log.info("Workflow {} planned as {} with {} phase(s): {}", runtime.requestId(),
                result.workflowClass(), result.plan().size(),
                result.plan().phases().stream().map(p -> p.name()).toList());
        eventBus.publish(OverseerEvent.of("workflow.classified", runtime.requestId(), null, Map.of(
                "workflowClass", result.workflowClass().name(),
                "tier", result.tier().name(),
                "rule", result.rationale().rule(),
                "confidence", result.rationale().confidence(),
                "aggregate", result.score().aggregate(),
                "phases", result.plan().phases().stream().map(p -> p.name()).toList())));

        return Map.of("status", instance.status().name(), "phaseIndex", 0);
    }

    static Request withSessionPatterns(Request request, List<String> sessionPatterns) {
        if (sessionPatterns.isEmpty()) {
            return request;
        }
        SessionContext context = request.context();
        var merged = new LinkedHashSet<>(context.priorPatterns());
        merged.addAll(sessionPatterns);
        if (merged.size() == context.priorPatterns().size()) {
            return request;
        }
        return request.withContext(new SessionContext(List.copyOf(merged), context.recentFiles(),
                context.currentTokens(), context.loadedFiles()));
    }

    private void onTransition(WorkflowRuntime runtime, StateTransition transition) {
        runtime.record().appendTransition(transition);
        String type = StateTransition.WORKFLOW.equals(transition.subject())
                ? "workflow.transition" : "phase.transition";
        eventBus.publish(OverseerEvent.of(type, runtime.requestId(), null, Map.of(
                "subject", transition.subject(),
                "from", transition.from(),
                "to", transition.to(),
                "reason", transition.reason())));
    }
}
