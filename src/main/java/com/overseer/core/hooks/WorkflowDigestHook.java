package com.overseer.core.hooks;

import java.util.ArrayList;
import java.util.Map;

/**
 * Emits an end-of-workflow digest and remembers the last finished workflow in the session.
 */
public class WorkflowDigestHook implements Hook {

    @Override
    public String name() {
        return "workflow-digest";
    }

    @Override
    public int priority() {
        return 900;
    }

    @Override
    public HookResult run(HookContext context) {
        String status = context.attribute(HookAttributes.STATUS);
        String summary = String.format("Workflow %s finished %s: %s resource(s) modified, %s error(s)",
                context.requestId(), status,
                valueOr(context.attribute(HookAttributes.MODIFIED_COUNT)), valueOr(context.attribute(HookAttributes.ERROR_COUNT)));

        var findings = new ArrayList<String>();
        String warnings = context.attribute(HookAttributes.WARNING_COUNT);
        if (warnings != null && !"0".equals(warnings)) {
            findings.add(warnings + " warning(s) recorded");
        }

        return HookResult.success(new HookPayload.StopReport(summary, findings))
                .withDisplayText(summary)
                .withStatePatch(Map.of(
                        "lastWorkflow", context.requestId(),
                        "lastStatus", status != null ? status : "UNKNOWN"));
    }

    private static String valueOr(String value) {
        return value != null ? value : "0";
    }
}
