package com.overseer.core.swarm;

import com.overseer.core.model.Phase;
import com.overseer.core.model.TaskOutcome;
import com.overseer.core.model.VerificationVerdict;

import java.util.List;
import java.util.Map;

/**
 * Judges task outcomes after a phase's waves have finished.
 */
public interface VerificationProvider {

    /**
     * @return a verdict per task id; tasks missing from the map are judged by their worker's outcome
     */
    Map<String, VerificationVerdict> verify(Phase phase, List<TaskOutcome> outcomes);
}
