package com.overseer.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Immutable input to the engine: free text plus optional file hints, session context and risk answers.
 * <p>
 * Blank descriptions are rejected; descriptions longer than {@link #MAX_DESCRIPTION_LENGTH}
 * characters are truncated.
 */
public record Request(
    String description,
    List<String> fileHints,
    SessionContext context,
    RiskAnswers riskAnswers
) implements Serializable {

    public static final int MAX_DESCRIPTION_LENGTH = 10_000;

    public Request {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Request description must not be blank");
        }
        description = description.strip();
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            description = description.substring(0, MAX_DESCRIPTION_LENGTH);
        }
        fileHints = fileHints == null ? List.of() : fileHints.stream()
                .filter(f -> f != null && !f.isBlank())
                .map(String::strip)
                .distinct()
                .toList();
        context = context == null ? SessionContext.empty() : context;
        riskAnswers = riskAnswers == null ? RiskAnswers.none() : riskAnswers;
    }

    public static Request of(String description) {
        return new Request(description, List.of(), SessionContext.empty(), RiskAnswers.none());
    }

    public static Request of(String description, List<String> fileHints) {
        return new Request(description, fileHints, SessionContext.empty(), RiskAnswers.none());
    }

    public Request withRiskAnswers(RiskAnswers answers) {
        return new Request(description, fileHints, context, answers);
    }

    public Request withContext(SessionContext sessionContext) {
        return new Request(description, fileHints, sessionContext, riskAnswers);
    }
}
