package com.overseer.core.hooks;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Structured hook output, one shape per lifecycle point, plus an opaque escape hatch for
 * provider-specific data.
 */
public sealed interface HookPayload extends Serializable
        permits HookPayload.SubmitAdvice, HookPayload.MutationReport, HookPayload.StopReport, HookPayload.Opaque {

    /** Advice produced when a request is submitted. */
    record SubmitAdvice(List<String> advice, List<String> patterns) implements HookPayload {
        public SubmitAdvice {
            advice = advice == null ? List.of() : List.copyOf(advice);
            patterns = patterns == null ? List.of() : List.copyOf(patterns);
        }
    }

    /** Findings about resources a worker just modified. */
    record MutationReport(List<String> resources, List<String> findings) implements HookPayload {
        public MutationReport {
            resources = resources == null ? List.of() : List.copyOf(resources);
            findings = findings == null ? List.of() : List.copyOf(findings);
        }
    }

    /** End-of-workflow report. */
    record StopReport(String summary, List<String> findings) implements HookPayload {
        public StopReport {
            summary = summary == null ? "" : summary;
            findings = findings == null ? List.of() : List.copyOf(findings);
        }
    }

    /** Provider-specific data the engine does not interpret. */
    record Opaque(Map<String, Object> data) implements HookPayload {
        public Opaque {
            data = data == null ? Map.of() : Map.copyOf(data);
        }
    }

    static HookPayload empty() {
        return new Opaque(Map.of());
    }
}
