package com.overseer.core.classifier;

import com.overseer.core.config.OverseerProperties;
import com.overseer.core.model.Dimension;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword tables, dimension weights and plan-selection thresholds consumed by the
 * {@link RequestClassifier}. Keyword weights are expressed on a unit scale and
 * projected onto the 0-10 score range by the scorer.
 *
 * @param complexityWeights   signed weights; summed and squashed through a sigmoid
 * @param riskWeights         additive risk indicators
 * @param urgencyWeights      urgency indicators; the strongest one wins
 * @param securityWeights     additive security-sensitivity indicators
 * @param dimensionWeights    weights of the dimensions that raise the aggregate
 * @param easingWeights       weights of the dimensions that lower the aggregate
 */
public record ClassificationRules(
    Map<String, Double> complexityWeights,
    double sigmoidCenter,
    double sigmoidScale,
    Map<String, Double> riskWeights,
    Map<String, Double> urgencyWeights,
    List<String> timePhrases,
    List<String> globalScopeWords,
    List<String> multiScopeWords,
    List<String> growthIndicators,
    Map<String, Double> securityWeights,
    List<String> minimalismWords,
    List<String> reuseWords,
    Map<Dimension, Double> dimensionWeights,
    Map<Dimension, Double> easingWeights,
    double contextCeiling,
    double highComplexity,
    double highAggregate,
    double riskGate,
    double lowAggregate,
    double lowContext
) {

    static final Map<String, Double> DEFAULT_COMPLEXITY = ordered(
            // high
            "architecture", 0.3, "refactor", 0.25, "migrate", 0.25, "system", 0.2, "complex", 0.2,
            "algorithm", 0.25, "optimization", 0.2, "integration", 0.2, "scalable", 0.2, "distributed", 0.3,
            // medium
            "implement", 0.15, "create", 0.1, "build", 0.1, "design", 0.15, "api", 0.15,
            "database", 0.15, "auth", 0.15, "security", 0.2,
            // low
            "fix", -0.1, "update", -0.05, "change", -0.05, "small", -0.1, "simple", -0.15,
            "quick", -0.1, "typo", -0.2);

    static final Map<String, Double> DEFAULT_RISK = ordered(
            // critical
            "breaking", 0.4, "delete", 0.3, "remove", 0.3, "drop", 0.3, "migrate", 0.25,
            "production", 0.3, "live", 0.3, "critical", 0.4,
            // high
            "security", 0.25, "auth", 0.2, "password", 0.25, "permission", 0.2, "admin", 0.2,
            "schema", 0.2, "database", 0.15, "api", 0.1,
            // medium
            "change", 0.05, "modify", 0.05, "update", 0.05, "refactor", 0.1);

    static final Map<String, Double> DEFAULT_URGENCY = ordered(
            "urgent", 0.3, "asap", 0.35, "immediately", 0.35, "critical", 0.4, "emergency", 0.45,
            "quickly", 0.25, "fast", 0.2, "soon", 0.15, "deadline", 0.25, "priority", 0.2, "rush", 0.3);

    static final Map<String, Double> DEFAULT_SECURITY = ordered(
            "security", 0.3, "auth", 0.25, "authentication", 0.25, "authorization", 0.25,
            "password", 0.3, "credential", 0.35, "credentials", 0.35, "secret", 0.3, "secrets", 0.3,
            "token", 0.2, "encryption", 0.25, "permission", 0.2, "privacy", 0.25, "pii", 0.35,
            "signing", 0.3, "certificate", 0.25, "vulnerability", 0.3, "injection", 0.3,
            "xss", 0.3, "csrf", 0.3);

    static final List<String> DEFAULT_TIME_PHRASES = List.of("today", "tonight", "tomorrow", "this morning", "right now");
    static final List<String> DEFAULT_GLOBAL_SCOPE = List.of("all", "entire", "every", "across", "throughout", "system-wide");
    static final List<String> DEFAULT_MULTI_SCOPE = List.of("multiple", "several", "various", "different", "many");
    static final List<String> DEFAULT_GROWTH = List.of(
            "implement", "create", "build", "design", "refactor", "architecture", "system", "complex", "integration");
    static final List<String> DEFAULT_MINIMALISM = List.of(
            "minimal", "small", "simple", "only", "just", "typo", "one-line", "tweak", "trivial");
    static final List<String> DEFAULT_REUSE = List.of(
            "reuse", "existing", "pattern", "template", "similar", "same as", "like before");

    public ClassificationRules {
        complexityWeights = Collections.unmodifiableMap(new LinkedHashMap<>(complexityWeights));
        riskWeights = Collections.unmodifiableMap(new LinkedHashMap<>(riskWeights));
        urgencyWeights = Collections.unmodifiableMap(new LinkedHashMap<>(urgencyWeights));
        securityWeights = Collections.unmodifiableMap(new LinkedHashMap<>(securityWeights));
        timePhrases = List.copyOf(timePhrases);
        globalScopeWords = List.copyOf(globalScopeWords);
        multiScopeWords = List.copyOf(multiScopeWords);
        growthIndicators = List.copyOf(growthIndicators);
        minimalismWords = List.copyOf(minimalismWords);
        reuseWords = List.copyOf(reuseWords);
        var raising = new EnumMap<Dimension, Double>(Dimension.class);
        raising.putAll(dimensionWeights);
        dimensionWeights = Collections.unmodifiableMap(raising);
        var easing = new EnumMap<Dimension, Double>(Dimension.class);
        easing.putAll(easingWeights);
        easingWeights = Collections.unmodifiableMap(easing);
    }

    public static ClassificationRules defaults() {
        return from(new OverseerProperties.Classifier());
    }

    /**
     * Builds rules from configuration. Empty keyword tables and missing weights keep their defaults.
     */
    public static ClassificationRules from(OverseerProperties.Classifier config) {
        var raising = new EnumMap<Dimension, Double>(Dimension.class);
        raising.put(Dimension.TECHNICAL_COMPLEXITY, 0.25);
        raising.put(Dimension.SCOPE, 0.15);
        raising.put(Dimension.RISK, 0.20);
        raising.put(Dimension.CONTEXT_LOAD, 0.15);
        raising.put(Dimension.TIME_PRESSURE, 0.05);
        raising.put(Dimension.SECURITY, 0.10);
        var easing = new EnumMap<Dimension, Double>(Dimension.class);
        easing.put(Dimension.MINIMALISM, 0.05);
        easing.put(Dimension.REUSABILITY, 0.05);

        config.getWeights().forEach((name, weight) -> {
            Dimension dimension = Dimension.valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
            if (easing.containsKey(dimension)) {
                easing.put(dimension, weight);
            } else {
                raising.put(dimension, weight);
            }
        });

        return new ClassificationRules(
                orDefault(config.getComplexityKeywords(), DEFAULT_COMPLEXITY),
                0.3, 0.2,
                orDefault(config.getRiskKeywords(), DEFAULT_RISK),
                orDefault(config.getUrgencyKeywords(), DEFAULT_URGENCY),
                DEFAULT_TIME_PHRASES,
                DEFAULT_GLOBAL_SCOPE,
                DEFAULT_MULTI_SCOPE,
                DEFAULT_GROWTH,
                orDefault(config.getSecurityKeywords(), DEFAULT_SECURITY),
                DEFAULT_MINIMALISM,
                DEFAULT_REUSE,
                raising,
                easing,
                config.getContextCeiling(),
                config.getHighComplexity(),
                config.getHighAggregate(),
                8.0,
                config.getLowAggregate(),
                config.getLowContext());
    }

    private static Map<String, Double> orDefault(Map<String, Double> configured, Map<String, Double> fallback) {
        return configured == null || configured.isEmpty() ? fallback : configured;
    }

    private static Map<String, Double> ordered(Object... pairs) {
        var map = new LinkedHashMap<String, Double>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (Double) pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
