package com.overseer.core.swarm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default executor used when no worker runtime is wired in. Reports progress once and claims
 * every resource of its task as modified.
 */
public class DryRunAgentExecutor implements AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(DryRunAgentExecutor.class);

    @Override
    public WorkerReport execute(WorkerContext context) {
        context.reportProgress("dry run: " + context.task().description());
        log.info("Dry run of task {} by {} ({} resources)",
                context.task().id(), context.workerId(), context.task().resources().size());
        return WorkerReport.success(context.task().resources(),
                "dry run of '" + context.task().description() + "'");
    }
}
