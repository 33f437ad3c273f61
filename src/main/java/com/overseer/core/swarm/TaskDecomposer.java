package com.overseer.core.swarm;

import com.overseer.core.model.AgentTask;
import com.overseer.core.model.Phase;
import com.overseer.core.model.Request;

import java.util.List;

/**
 * Splits a request into the tasks of one phase. Sibling tasks must claim disjoint resources.
 */
public interface TaskDecomposer {

    List<AgentTask> decompose(Phase phase, Request request);
}
