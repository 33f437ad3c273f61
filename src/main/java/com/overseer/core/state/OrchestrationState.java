package com.overseer.core.state;

import com.overseer.core.model.WorkflowStatus;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.Map;

/**
 * Graph state for one workflow run. Deliberately scalar: rich run-state lives in the
 * workflow registry so that re-invoking the graph after a confirmation resumes cleanly.
 */
public class OrchestrationState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("requestId",  Channels.base(() -> "")),
        Map.entry("status",     Channels.base(() -> WorkflowStatus.NOT_STARTED.name())),
        Map.entry("phaseIndex", Channels.base(() -> 0))
    );

    public OrchestrationState(Map<String, Object> initData) {
        super(initData);
    }

    public String requestId() {
        return this.<String>value("requestId").orElse("");
    }

    public WorkflowStatus status() {
        String raw = this.<String>value("status").orElse(WorkflowStatus.NOT_STARTED.name());
        return WorkflowStatus.valueOf(raw);
    }

    public int phaseIndex() {
        return this.<Integer>value("phaseIndex").orElse(0);
    }
}
