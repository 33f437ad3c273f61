package com.overseer.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.overseer.core.model.Request;
import com.overseer.core.model.RiskAnswers;
import com.overseer.core.model.SessionContext;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/workflows and /api/v1/classify.
 *
 * @param request           natural-language request
 * @param fileHints         resources the request is expected to touch; nullable
 * @param priorPatterns     patterns already seen in this session; nullable
 * @param failureScenario   risk answer: what breaks if this goes wrong
 * @param detectionSignal   risk answer: how a failure would be noticed
 * @param fastestRollback   risk answer: the quickest way back
 * @param weakestAssumption risk answer: the assumption most likely to be wrong
 */
public record WorkflowRequest(
    String request,
    @JsonProperty("file_hints") List<String> fileHints,
    @JsonProperty("prior_patterns") List<String> priorPatterns,
    @JsonProperty("failure_scenario") String failureScenario,
    @JsonProperty("detection_signal") String detectionSignal,
    @JsonProperty("fastest_rollback") String fastestRollback,
    @JsonProperty("weakest_assumption") String weakestAssumption
) {

    public Request toRequest() {
        var context = new SessionContext(priorPatterns, List.of(), 0, 0);
        var answers = new RiskAnswers(failureScenario, detectionSignal, fastestRollback, weakestAssumption);
        return new Request(request, fileHints, context, answers);
    }
}
