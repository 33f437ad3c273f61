package com.overseer.core.swarm;

/**
 * Worker runtime. Implementations perform the actual work of one task and should call
 * {@link WorkerContext#reportProgress} regularly and stop early once
 * {@link WorkerContext#isCancelled()} turns true.
 */
@FunctionalInterface
public interface AgentExecutor {

    WorkerReport execute(WorkerContext context) throws Exception;
}
