package com.overseer.core.classifier;

import com.overseer.core.model.Dimension;
import com.overseer.core.model.KeywordMatcher;
import com.overseer.core.model.Request;
import com.overseer.core.model.Score;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

/**
 * Scores each {@link Dimension} independently from lexical signals in the request and its
 * session context. A dimension whose function throws or yields a value outside the unit range
 * is reported as unscorable instead of failing the whole classification.
 */
public class DimensionScorer {

    private static final Logger log = LoggerFactory.getLogger(DimensionScorer.class);

    private final ClassificationRules rules;
    private final Map<Dimension, DimensionFunction> functions;

    public DimensionScorer(ClassificationRules rules) {
        this(rules, Map.of());
    }

    /**
     * @param overrides replacements for individual dimension functions
     */
    public DimensionScorer(ClassificationRules rules, Map<Dimension, DimensionFunction> overrides) {
        this.rules = rules;
        var all = new EnumMap<Dimension, DimensionFunction>(Dimension.class);
        all.put(Dimension.TECHNICAL_COMPLEXITY, DimensionScorer::technicalComplexity);
        all.put(Dimension.SCOPE, DimensionScorer::scope);
        all.put(Dimension.RISK, DimensionScorer::risk);
        all.put(Dimension.CONTEXT_LOAD, DimensionScorer::contextLoad);
        all.put(Dimension.TIME_PRESSURE, DimensionScorer::timePressure);
        all.put(Dimension.MINIMALISM, DimensionScorer::minimalism);
        all.put(Dimension.SECURITY, DimensionScorer::security);
        all.put(Dimension.REUSABILITY, DimensionScorer::reusability);
        all.putAll(overrides);
        this.functions = all;
    }

    public Score score(Request request) {
        var values = new EnumMap<Dimension, Double>(Dimension.class);
        var unscorable = EnumSet.noneOf(Dimension.class);
        for (var entry : functions.entrySet()) {
            Dimension dimension = entry.getKey();
            try {
                double unit = entry.getValue().score(request, rules);
                if (!Double.isFinite(unit) || unit < 0.0 || unit > 1.0) {
                    log.warn("Invalid {} score {}, marking dimension unscorable", dimension, unit);
                    unscorable.add(dimension);
                    continue;
                }
                values.put(dimension, round(unit * Score.MAX));
            } catch (RuntimeException e) {
                log.warn("Failed to score {}: {}", dimension, e.getMessage(), e);
                unscorable.add(dimension);
            }
        }
        return new Score(values, unscorable, aggregate(values));
    }

    /**
     * Weighted mean of the raising dimensions, lowered by the weighted easing dimensions.
     */
    double aggregate(Map<Dimension, Double> values) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (var entry : rules.dimensionWeights().entrySet()) {
            Double value = values.get(entry.getKey());
            if (value != null) {
                weighted += entry.getValue() * value;
                totalWeight += entry.getValue();
            }
        }
        double mean = totalWeight > 0 ? weighted / totalWeight : 0.0;
        double easing = 0.0;
        for (var entry : rules.easingWeights().entrySet()) {
            Double value = values.get(entry.getKey());
            if (value != null) {
                easing += entry.getValue() * value;
            }
        }
        return round(Score.clamp(mean - easing));
    }

    // -- dimension functions (unit scale) -------------------------------------

    static double technicalComplexity(Request request, ClassificationRules rules) {
        String text = request.description();
        double raw = 0.0;
        for (var entry : rules.complexityWeights().entrySet()) {
            if (KeywordMatcher.contains(text, entry.getKey())) {
                raw += entry.getValue();
                if (raw > 1.5) {
                    break;
                }
            }
        }
        return 1.0 / (1.0 + Math.exp(-(raw - rules.sigmoidCenter()) / rules.sigmoidScale()));
    }

    static double scope(Request request, ClassificationRules rules) {
        String text = request.description();
        double score = 0.0;
        score += Math.min(0.4, KeywordMatcher.matching(text, rules.globalScopeWords()).size() * 0.15);
        score += Math.min(0.3, KeywordMatcher.matching(text, rules.multiScopeWords()).size() * 0.1);

        int files = Math.max(request.fileHints().size(), request.context().loadedFiles());
        if (files > 10) {
            score += 0.2;
        } else if (files > 5) {
            score += 0.1;
        }

        int words = text.split("\\s+").length;
        if (words > 100) {
            score += 0.2;
        } else if (words > 50) {
            score += 0.1;
        }
        return unit(score);
    }

    static double risk(Request request, ClassificationRules rules) {
        return unit(weightedSum(request.description(), rules.riskWeights()));
    }

    static double contextLoad(Request request, ClassificationRules rules) {
        var context = request.context();
        double base = Math.min(0.5, context.currentTokens() / 25_000.0);
        double files = Math.min(0.3, (context.loadedFiles() + request.fileHints().size()) / 20.0);
        int growth = KeywordMatcher.matching(request.description(), rules.growthIndicators()).size();
        double predicted = Math.min(0.4, growth * 0.08);
        return unit(base + files + predicted);
    }

    static double timePressure(Request request, ClassificationRules rules) {
        String text = request.description();
        double score = 0.0;
        int indicators = 0;
        for (var entry : rules.urgencyWeights().entrySet()) {
            if (KeywordMatcher.contains(text, entry.getKey())) {
                score = Math.max(score, entry.getValue());
                indicators++;
            }
        }
        if (KeywordMatcher.containsAny(text, rules.timePhrases())) {
            score = Math.max(score, 0.4);
        }
        if (indicators > 2) {
            score += 0.1;
        }
        return unit(score);
    }

    static double minimalism(Request request, ClassificationRules rules) {
        double score = KeywordMatcher.matching(request.description(), rules.minimalismWords()).size() * 0.2;
        if (request.fileHints().size() == 1) {
            score += 0.2;
        }
        return unit(Math.min(0.8, score));
    }

    static double security(Request request, ClassificationRules rules) {
        String text = request.description() + " " + String.join(" ", request.fileHints());
        return unit(weightedSum(text, rules.securityWeights()));
    }

    static double reusability(Request request, ClassificationRules rules) {
        String text = request.description();
        long known = request.context().priorPatterns().stream()
                .filter(pattern -> KeywordMatcher.contains(text, pattern))
                .count();
        double score = Math.min(0.6, known * 0.2);
        score += Math.min(0.4, KeywordMatcher.matching(text, rules.reuseWords()).size() * 0.1);
        return unit(score);
    }

    private static double weightedSum(String text, Map<String, Double> weights) {
        double sum = 0.0;
        for (var entry : weights.entrySet()) {
            if (KeywordMatcher.contains(text, entry.getKey())) {
                sum += entry.getValue();
            }
        }
        return sum;
    }

    private static double unit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
