package com.overseer.core.risk;

import com.overseer.core.config.OverseerProperties;
import com.overseer.core.model.RiskTier;
import com.overseer.core.model.TaskDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Assigns a {@link RiskTier} to a unit of work. Evaluated top-down, first match wins:
 * <ol>
 *   <li>irreversible or regulated effect: T3</li>
 *   <li>security, privacy or data-integrity implication: T2</li>
 *   <li>user-visible behavior change, or resources spanning modules: T1</li>
 *   <li>otherwise T0</li>
 * </ol>
 * {@link #classify} additionally refuses T1-T3 tasks whose risk answers are incomplete.
 */
@Service
public class RiskClassifier {

    private static final Logger log = LoggerFactory.getLogger(RiskClassifier.class);

    private final RiskRules rules;

    @Autowired
    public RiskClassifier(OverseerProperties properties) {
        this(RiskRules.from(properties.getRisk()));
    }

    public RiskClassifier(RiskRules rules) {
        this.rules = rules;
    }

    public RiskDecision decide(TaskDescriptor descriptor) {
        List<String> irreversible = rules.irreversibleMatches(descriptor);
        if (!irreversible.isEmpty()) {
            return new RiskDecision(RiskTier.T3, "irreversible or regulated effect " + irreversible);
        }
        List<String> security = rules.securityMatches(descriptor);
        if (!security.isEmpty()) {
            return new RiskDecision(RiskTier.T2, "security or data-integrity implication " + security);
        }
        List<String> visible = rules.userVisibleMatches(descriptor);
        if (!visible.isEmpty()) {
            return new RiskDecision(RiskTier.T1, "user-visible behavior change " + visible);
        }
        if (rules.spansModules(descriptor)) {
            return new RiskDecision(RiskTier.T1, "changes span multiple modules");
        }
        return new RiskDecision(RiskTier.T0, "no risk indicators");
    }

    /**
     * Evaluates the decision tree without the readiness gate.
     */
    public RiskTier tierOf(TaskDescriptor descriptor) {
        return decide(descriptor).tier();
    }

    /**
     * Evaluates the decision tree and verifies the task is ready for execution.
     *
     * @throws IncompleteRiskAssessmentException if the tier is T1-T3 and a risk answer is missing
     */
    public RiskTier classify(TaskDescriptor descriptor) {
        RiskTier tier = tierOf(descriptor);
        requireReady(tier, descriptor);
        return tier;
    }

    /**
     * Classifies within a session: the tier in force is never lower than the tier already
     * recorded for the same task, nor lower than {@code floor}.
     */
    public RiskTier classify(TaskDescriptor descriptor, RiskLedger ledger, RiskTier floor) {
        RiskTier tier = ledger.escalate(descriptor.key(), RiskTier.max(tierOf(descriptor), floor));
        requireReady(tier, descriptor);
        return tier;
    }

    public void requireReady(RiskTier tier, TaskDescriptor descriptor) {
        if (!tier.requiresRiskAnswers()) {
            return;
        }
        List<String> missing = descriptor.answers().missingFields();
        if (!missing.isEmpty()) {
            log.warn("Task '{}' classified {} but risk answers are missing: {}",
                    abbreviate(descriptor.description()), tier, missing);
            throw new IncompleteRiskAssessmentException(tier, missing);
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 60 ? text : text.substring(0, 57) + "...";
    }
}
