package com.overseer.core.hooks;

import com.overseer.core.session.SessionState;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Records the salient terms of each submitted request as session patterns, and points out
 * terms the session has already seen.
 */
public class SessionPatternHook implements Hook {

    static final int MAX_PATTERNS = 50;
    private static final int TERMS_PER_REQUEST = 5;
    private static final Set<String> STOP_WORDS = Set.of(
            "about", "after", "again", "against", "before", "being", "below", "could", "during",
            "every", "other", "should", "their", "there", "these", "those", "through", "under",
            "until", "where", "which", "while", "would", "please", "thing", "things");

    @Override
    public String name() {
        return "session-patterns";
    }

    @Override
    public int priority() {
        return 50;
    }

    @Override
    public boolean shouldRun(HookContext context) {
        String text = context.attribute(HookAttributes.REQUEST);
        return text != null && !text.isBlank();
    }

    @Override
    public HookResult run(HookContext context) {
        List<String> terms = salientTerms(context.attribute(HookAttributes.REQUEST));
        List<String> known = context.session() != null ? context.session().patterns() : List.of();

        var advice = new ArrayList<String>();
        for (String term : terms) {
            if (known.contains(term)) {
                advice.add("Reuses known pattern '" + term + "'");
            }
        }

        var merged = new LinkedHashSet<>(known);
        merged.addAll(terms);
        var patterns = new ArrayList<>(merged);
        if (patterns.size() > MAX_PATTERNS) {
            patterns = new ArrayList<>(patterns.subList(patterns.size() - MAX_PATTERNS, patterns.size()));
        }

        return HookResult.success(new HookPayload.SubmitAdvice(advice, terms))
                .withStatePatch(Map.of(SessionState.PATTERNS, List.copyOf(patterns)));
    }

    static List<String> salientTerms(String text) {
        var terms = new LinkedHashSet<String>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9_-]+")) {
            if (token.length() >= 5 && !STOP_WORDS.contains(token)) {
                terms.add(token);
                if (terms.size() == TERMS_PER_REQUEST) {
                    break;
                }
            }
        }
        return List.copyOf(terms);
    }
}
