package com.overseer.core.swarm;

import com.overseer.core.model.AgentTask;

import java.util.List;

/**
 * What one worker executes: a single task, or several related tasks merged under budget
 * pressure. {@code task} is the task the worker sees; {@code members} are the planned tasks
 * it stands for.
 */
public record WorkUnit(AgentTask task, List<AgentTask> members) {

    public WorkUnit {
        members = List.copyOf(members);
    }

    public static WorkUnit single(AgentTask task) {
        return new WorkUnit(task, List.of(task));
    }

    public boolean merged() {
        return members.size() > 1;
    }

    public boolean critical() {
        return members.stream().anyMatch(AgentTask::critical);
    }

    public List<String> memberIds() {
        return members.stream().map(AgentTask::id).toList();
    }
}
