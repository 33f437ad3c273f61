package com.overseer.core.swarm;

import com.overseer.core.model.Phase;
import com.overseer.core.model.TaskOutcome;
import com.overseer.core.model.TaskStatus;
import com.overseer.core.model.VerificationVerdict;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Judges a task by what its worker reported: completed passes, anything else fails.
 */
public class OutcomeVerificationProvider implements VerificationProvider {

    static final String OUTCOME_CHECK = "outcome";

    @Override
    public Map<String, VerificationVerdict> verify(Phase phase, List<TaskOutcome> outcomes) {
        var verdicts = new LinkedHashMap<String, VerificationVerdict>();
        for (TaskOutcome outcome : outcomes) {
            verdicts.put(outcome.taskId(), judge(outcome));
        }
        return verdicts;
    }

    static VerificationVerdict judge(TaskOutcome outcome) {
        if (outcome.status() == TaskStatus.COMPLETED) {
            return VerificationVerdict.pass("worker reported success");
        }
        String detail = outcome.error() != null ? outcome.error() : "worker ended " + outcome.status();
        return VerificationVerdict.fail(detail, List.of(OUTCOME_CHECK));
    }
}
