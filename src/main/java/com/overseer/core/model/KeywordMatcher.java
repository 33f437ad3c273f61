package com.overseer.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Case-insensitive, word-boundary keyword matching shared by the risk and request classifiers.
 * Multi-word keywords match as phrases with any whitespace between words.
 */
public final class KeywordMatcher {

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private KeywordMatcher() {} // utility class

    public static boolean contains(String text, String keyword) {
        if (text == null || text.isBlank() || keyword == null || keyword.isBlank()) {
            return false;
        }
        return pattern(keyword).matcher(text).find();
    }

    public static int count(String text, String keyword) {
        if (text == null || text.isBlank() || keyword == null || keyword.isBlank()) {
            return 0;
        }
        var matcher = pattern(keyword).matcher(text);
        int n = 0;
        while (matcher.find()) {
            n++;
        }
        return n;
    }

    /**
     * Returns the keywords from {@code keywords} that occur in {@code text}, in iteration order.
     */
    public static List<String> matching(String text, Collection<String> keywords) {
        var matched = new ArrayList<String>();
        for (String keyword : keywords) {
            if (contains(text, keyword)) {
                matched.add(keyword);
            }
        }
        return matched;
    }

    public static boolean containsAny(String text, Collection<String> keywords) {
        for (String keyword : keywords) {
            if (contains(text, keyword)) {
                return true;
            }
        }
        return false;
    }

    private static Pattern pattern(String keyword) {
        return PATTERNS.computeIfAbsent(keyword.toLowerCase(Locale.ROOT), k -> {
            String body = String.join("\\s+", java.util.Arrays.stream(k.trim().split("\\s+"))
                    .map(Pattern::quote)
                    .toList());
            return Pattern.compile("\\b" + body + "\\b", Pattern.CASE_INSENSITIVE);
        });
    }
}
