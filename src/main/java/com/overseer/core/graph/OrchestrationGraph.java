package com.overseer.core.graph;

import com.overseer.core.model.WorkflowStatus;
import com.overseer.core.nodes.ClassifyRequestNode;
import com.overseer.core.nodes.ExecutePhaseNode;
import com.overseer.core.nodes.StopHooksNode;
import com.overseer.core.nodes.SubmitHooksNode;
import com.overseer.core.state.OrchestrationState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives a workflow.
 * <pre>
 *   START -> classify_request -> submit_hooks -> execute_phase -> [routeAfterPhase]
 *            -> execute_phase (next phase)
 *            -> await_confirmation -> END  (T3 phase waiting for a human)
 *            -> stop_hooks -> END          (terminal status)
 * </pre>
 * Resuming after a confirmation re-invokes the graph; nodes that already ran pass through.
 */
@Component
public class OrchestrationGraph {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationGraph.class);

    private final CompiledGraph<OrchestrationState> compiledGraph;

    public OrchestrationGraph(
            ClassifyRequestNode classifyNode,
            SubmitHooksNode submitHooksNode,
            ExecutePhaseNode executePhaseNode,
            StopHooksNode stopHooksNode,
            @Autowired(required = false) BaseCheckpointSaver checkpointSaver) throws Exception {

        var graph = new StateGraph<>(OrchestrationState.SCHEMA, OrchestrationState::new)
                .addNode("classify_request", node_async(classifyNode::apply))
                .addNode("submit_hooks", node_async(submitHooksNode::apply))
                .addNode("execute_phase", node_async(executePhaseNode::apply))
                .addNode("await_confirmation", node_async(
                        state -> Map.of("status", WorkflowStatus.AWAITING_CONFIRMATION.name())))
                .addNode("stop_hooks", node_async(stopHooksNode::apply))
                .addEdge(START, "classify_request")
                .addEdge("classify_request", "submit_hooks")
                .addEdge("submit_hooks", "execute_phase")
                .addConditionalEdges("execute_phase",
                        edge_async(this::routeAfterPhase),
                        Map.of("execute_phase", "execute_phase",
                                "await_confirmation", "await_confirmation",
                                "stop_hooks", "stop_hooks"))
                .addEdge("await_confirmation", END)
                .addEdge("stop_hooks", END);

        var configBuilder = CompileConfig.builder();
        if (checkpointSaver != null) {
            configBuilder.checkpointSaver(checkpointSaver);
            log.info("Graph compiled with checkpoint saver: {}", checkpointSaver.getClass().getSimpleName());
        } else {
            log.info("Graph compiled without checkpoint saver");
        }
        this.compiledGraph = graph.compile(configBuilder.build());
    }

    /**
     * RUNNING loops to the next phase, a pending confirmation parks the workflow,
     * anything terminal goes to the stop hooks.
     */
    String routeAfterPhase(OrchestrationState state) {
        WorkflowStatus status = state.status();
        if (status == WorkflowStatus.AWAITING_CONFIRMATION) {
            return "await_confirmation";
        }
        if (status == WorkflowStatus.RUNNING) {
            return "execute_phase";
        }
        return "stop_hooks";
    }

    public CompiledGraph<OrchestrationState> getCompiledGraph() {
        return compiledGraph;
    }
}
