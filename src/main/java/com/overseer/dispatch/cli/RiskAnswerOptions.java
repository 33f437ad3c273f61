package com.overseer.dispatch.cli;

import com.overseer.core.model.RiskAnswers;
import picocli.CommandLine.Option;

/**
 * Shared options carrying the four risk answers.
 */
public class RiskAnswerOptions {

    @Option(names = "--failure-scenario", description = "What breaks if this change goes wrong")
    String failureScenario;

    @Option(names = "--detection-signal", description = "How a failure would be noticed")
    String detectionSignal;

    @Option(names = "--rollback", description = "Fastest way to undo the change")
    String fastestRollback;

    @Option(names = "--weakest-assumption", description = "The assumption most likely to be wrong")
    String weakestAssumption;

    RiskAnswers toAnswers() {
        return new RiskAnswers(failureScenario, detectionSignal, fastestRollback, weakestAssumption);
    }
}
