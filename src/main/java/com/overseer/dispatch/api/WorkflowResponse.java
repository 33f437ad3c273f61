package com.overseer.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.overseer.core.model.PhaseStatus;
import com.overseer.core.model.WorkflowReport;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON response for workflow endpoints.
 */
public record WorkflowResponse(
    @JsonProperty("request_id") String requestId,
    String status,
    @JsonProperty("workflow_class") String workflowClass,
    String tier,
    Map<String, String> phases,
    @JsonProperty("modified_resources") List<String> modifiedResources,
    List<String> errors,
    List<String> warnings,
    List<String> incidents,
    @JsonProperty("elapsed_ms") long elapsedMs
) {

    public static WorkflowResponse from(WorkflowReport report) {
        Map<String, String> phases = new LinkedHashMap<>();
        for (Map.Entry<String, PhaseStatus> entry : report.phases().entrySet()) {
            phases.put(entry.getKey(), entry.getValue().name());
        }
        return new WorkflowResponse(
                report.requestId(),
                report.status().name(),
                report.workflowClass() != null ? report.workflowClass().name() : null,
                report.tier() != null ? report.tier().name() : null,
                phases,
                report.modifiedResources(),
                report.errors(),
                report.warnings(),
                report.incidents(),
                report.elapsedMs());
    }
}
