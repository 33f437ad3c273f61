package com.overseer.core.classifier;

import com.overseer.core.config.OverseerProperties;
import com.overseer.core.model.ClassificationResult;
import com.overseer.core.model.DecisionRationale;
import com.overseer.core.model.Dimension;
import com.overseer.core.model.Request;
import com.overseer.core.model.RiskTier;
import com.overseer.core.model.Score;
import com.overseer.core.model.TaskDescriptor;
import com.overseer.core.model.WorkflowClass;
import com.overseer.core.model.WorkflowPlan;
import com.overseer.core.risk.RiskClassifier;
import com.overseer.core.session.OutcomeTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores a request across all dimensions and selects a workflow plan.
 * <p>
 * Rules are evaluated in order, first match wins:
 * <ol>
 *   <li>any dimension unscorable: conservative fully phased plan</li>
 *   <li>context load at or above its ceiling: phased (context bound dominates)</li>
 *   <li>high complexity or high aggregate: phased</li>
 *   <li>T2+ risk tier or critical risk score: standard</li>
 *   <li>low aggregate and low context load: direct</li>
 *   <li>otherwise standard</li>
 * </ol>
 * Classification is deterministic and never throws for a valid request.
 * <p>
 * Confidence scales with the margin between the deciding score and the nearest threshold,
 * and the other matching rules are recorded as alternatives.
 */
@Service
public class RequestClassifier {

    private static final Logger log = LoggerFactory.getLogger(RequestClassifier.class);

    static final String RULE_CONSERVATIVE = "conservative-fallback";
    static final String RULE_CONTEXT_BOUND = "context-bound";
    static final String RULE_HIGH_COMPLEXITY = "high-complexity";
    static final String RULE_RISK_GATED = "risk-gated";
    static final String RULE_SIMPLE = "simple-direct";
    static final String RULE_STANDARD = "standard";

    private static final double HIGH_FACTOR_LEVEL = 6.0;

    /** Confidence of each rule when its deciding score sits far from every threshold. */
    private static final Map<String, Double> RULE_CONFIDENCE = Map.of(
            RULE_CONSERVATIVE, 0.5,
            RULE_CONTEXT_BOUND, 0.95,
            RULE_HIGH_COMPLEXITY, 0.8,
            RULE_RISK_GATED, 0.9,
            RULE_SIMPLE, 0.85,
            RULE_STANDARD, 0.75);
    /** Score distance, on the 0-10 scale, at which a decision counts as fully clear of its threshold. */
    static final double MARGIN_SPAN = 2.0;
    /** Share of the rule confidence kept when the deciding score sits exactly on a threshold. */
    static final double MARGIN_FLOOR = 0.6;
    static final double HISTORY_LEARNING_RATE = 0.05;
    static final double MAX_HISTORY_WEIGHT = 0.3;

    private final DimensionScorer scorer;
    private final ClassificationRules rules;
    private final RiskClassifier riskClassifier;

    @Autowired
    public RequestClassifier(OverseerProperties properties, RiskClassifier riskClassifier) {
        this(ClassificationRules.from(properties.getClassifier()), riskClassifier);
    }

    public RequestClassifier(ClassificationRules rules, RiskClassifier riskClassifier) {
        this(new DimensionScorer(rules), rules, riskClassifier);
    }

    public RequestClassifier(DimensionScorer scorer, ClassificationRules rules, RiskClassifier riskClassifier) {
        this.scorer = scorer;
        this.rules = rules;
        this.riskClassifier = riskClassifier;
    }

    public ClassificationResult classify(Request request) {
        return classify(request, null);
    }

    /**
     * Classifies with the session's workflow outcomes blended into the confidence: a class that
     * kept failing this session is selected with less confidence, one that kept succeeding with more.
     */
    public ClassificationResult classify(Request request, OutcomeTracker history) {
        Score score = scorer.score(request);
        RiskTier tier = riskClassifier.tierOf(TaskDescriptor.of(request));
        List<Candidate> matched = candidates(score, tier);

        Candidate chosen;
        WorkflowPlan plan;
        if (!score.fullyScored()) {
            chosen = new Candidate(RULE_CONSERVATIVE, WorkflowClass.PHASED, 0.0);
            plan = WorkflowPlanner.conservative(tier);
        } else {
            chosen = matched.get(0);
            plan = WorkflowPlanner.plan(chosen.workflowClass(), tier);
        }

        double margin = chosen.margin();
        double confidence = RULE_CONFIDENCE.get(chosen.rule()) * (MARGIN_FLOOR + (1 - MARGIN_FLOOR) * margin);
        confidence = blendHistory(confidence, chosen.workflowClass(), history);

        var alternatives = new ArrayList<DecisionRationale.Alternative>();
        var seen = EnumSet.of(chosen.workflowClass());
        for (Candidate candidate : matched) {
            if (seen.add(candidate.workflowClass())) {
                alternatives.add(new DecisionRationale.Alternative(
                        candidate.workflowClass(), candidate.rule(), candidate.margin()));
            }
        }

        var rationale = new DecisionRationale(chosen.rule(), round(confidence), round(margin),
                factors(score, tier), alternatives);
        log.info("Classified request as {} (tier {}, rule {}, aggregate {}, confidence {})",
                plan.workflowClass(), tier, chosen.rule(), score.aggregate(), rationale.confidence());
        return new ClassificationResult(score, plan, rationale);
    }

    /**
     * Every rule that matches the score, in precedence order. The catch-all standard rule always matches.
     */
    private List<Candidate> candidates(Score score, RiskTier tier) {
        double context = score.get(Dimension.CONTEXT_LOAD);
        double complexity = score.get(Dimension.TECHNICAL_COMPLEXITY);
        double risk = score.get(Dimension.RISK);
        double aggregate = score.aggregate();
        boolean tierGated = tier.isAtLeast(RiskTier.T2);

        var matched = new ArrayList<Candidate>();
        if (context >= rules.contextCeiling()) {
            matched.add(candidate(RULE_CONTEXT_BOUND, WorkflowClass.PHASED, context - rules.contextCeiling()));
        }
        if (complexity >= rules.highComplexity() || aggregate >= rules.highAggregate()) {
            matched.add(candidate(RULE_HIGH_COMPLEXITY, WorkflowClass.PHASED,
                    Math.max(complexity - rules.highComplexity(), aggregate - rules.highAggregate())));
        }
        if (tierGated || risk >= rules.riskGate()) {
            matched.add(candidate(RULE_RISK_GATED, WorkflowClass.STANDARD,
                    tierGated ? MARGIN_SPAN : risk - rules.riskGate()));
        }
        if (!tierGated && aggregate < rules.lowAggregate() && context < rules.lowContext()) {
            matched.add(candidate(RULE_SIMPLE, WorkflowClass.DIRECT,
                    Math.min(rules.lowAggregate() - aggregate, rules.lowContext() - context)));
        }

        double nearest = Math.min(rules.contextCeiling() - context,
                Math.min(rules.highComplexity() - complexity, rules.highAggregate() - aggregate));
        if (!tierGated) {
            nearest = Math.min(nearest, rules.riskGate() - risk);
        }
        nearest = Math.min(nearest, aggregate >= rules.lowAggregate()
                ? aggregate - rules.lowAggregate()
                : context - rules.lowContext());
        matched.add(candidate(RULE_STANDARD, WorkflowClass.STANDARD, nearest));
        return matched;
    }

    private static Candidate candidate(String rule, WorkflowClass workflowClass, double distance) {
        return new Candidate(rule, workflowClass, Math.max(0.0, Math.min(1.0, distance / MARGIN_SPAN)));
    }

    private static double blendHistory(double confidence, WorkflowClass workflowClass, OutcomeTracker history) {
        if (history == null) {
            return confidence;
        }
        double rate = history.successRate(workflowClass);
        if (rate < 0) {
            return confidence;
        }
        double weight = Math.min(MAX_HISTORY_WEIGHT, history.total(workflowClass) * HISTORY_LEARNING_RATE);
        return confidence * (1 - weight) + rate * weight;
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    private record Candidate(String rule, WorkflowClass workflowClass, double margin) {}

    private List<String> factors(Score score, RiskTier tier) {
        var factors = new ArrayList<String>();
        for (Dimension dimension : Dimension.values()) {
            if (score.unscorable().contains(dimension)) {
                factors.add("Unscorable " + dimension.label());
            } else if (score.get(dimension) >= HIGH_FACTOR_LEVEL) {
                factors.add(String.format(Locale.ROOT, "High %s (%.1f)", dimension.label(), score.get(dimension)));
            }
        }
        if (tier != RiskTier.T0) {
            factors.add("Risk tier " + tier);
        }
        return factors;
    }
}
