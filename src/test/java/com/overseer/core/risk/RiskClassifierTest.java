package com.overseer.core.risk;

import com.overseer.core.model.RiskAnswers;
import com.overseer.core.model.RiskTier;
import com.overseer.core.model.TaskDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskClassifierTest {

    private static final RiskAnswers COMPLETE = new RiskAnswers(
            "login breaks", "error rate alert", "git revert", "tokens are not cached");

    private final RiskClassifier classifier = new RiskClassifier(RiskRules.defaults());

    private static TaskDescriptor task(String description, String... resources) {
        return new TaskDescriptor(description, List.of(resources), RiskAnswers.none());
    }

    @Nested
    @DisplayName("Decision tree")
    class DecisionTree {

        @Test
        @DisplayName("Typo fix in documentation is T0")
        void typoIsT0() {
            assertEquals(RiskTier.T0, classifier.tierOf(task("fix typo in README", "README.md")));
        }

        @Test
        @DisplayName("Credential changes are T3, including when only the path mentions them")
        void credentialsAreT3() {
            assertEquals(RiskTier.T3, classifier.tierOf(task("rotate credentials")));
            assertEquals(RiskTier.T3, classifier.tierOf(task("update values", "config/credentials.yml")));
        }

        @Test
        @DisplayName("Irreversible branch wins over security branch")
        void firstMatchWins() {
            var decision = classifier.decide(task("purge user passwords"));
            assertEquals(RiskTier.T3, decision.tier());
            assertTrue(decision.reason().contains("purge"));
        }

        @Test
        @DisplayName("Security implication is T2")
        void securityIsT2() {
            assertEquals(RiskTier.T2, classifier.tierOf(task("add password hashing")));
        }

        @Test
        @DisplayName("User-visible change is T1")
        void userVisibleIsT1() {
            assertEquals(RiskTier.T1, classifier.tierOf(task("add a new feature flag")));
        }

        @Test
        @DisplayName("Resources in several top-level modules are T1")
        void multiModuleIsT1() {
            assertEquals(RiskTier.T1, classifier.tierOf(task("tidy imports", "core/A.java", "web/B.java")));
            assertEquals(RiskTier.T0, classifier.tierOf(task("tidy imports", "core/A.java", "core/B.java")));
        }

        @Test
        @DisplayName("Keywords match on word boundaries only")
        void wordBoundaries() {
            assertEquals(RiskTier.T0, classifier.tierOf(task("update author name in footer")));
        }
    }

    @Nested
    @DisplayName("Readiness gate")
    class ReadinessGate {

        @Test
        @DisplayName("T0 tasks run without risk answers")
        void t0NeedsNoAnswers() {
            assertEquals(RiskTier.T0, classifier.classify(task("fix typo in README")));
        }

        @Test
        @DisplayName("T2 task without answers is refused with every missing field")
        void missingAnswersRefused() {
            var e = assertThrows(IncompleteRiskAssessmentException.class,
                    () -> classifier.classify(task("add password hashing")));
            assertEquals(RiskTier.T2, e.getTier());
            assertEquals(List.of("failureScenario", "detectionSignal", "fastestRollback", "weakestAssumption"),
                    e.getMissingFields());
        }

        @Test
        @DisplayName("A single blank answer is enough to refuse")
        void blankAnswerRefused() {
            var answers = new RiskAnswers("a", " ", "c", "d");
            var descriptor = new TaskDescriptor("add password hashing", List.of(), answers);
            var e = assertThrows(IncompleteRiskAssessmentException.class, () -> classifier.classify(descriptor));
            assertEquals(List.of("detectionSignal"), e.getMissingFields());
        }

        @Test
        @DisplayName("Complete answers let a T3 task through")
        void completeAnswersPass() {
            var descriptor = new TaskDescriptor("rotate credentials", List.of(), COMPLETE);
            assertEquals(RiskTier.T3, classifier.classify(descriptor));
        }
    }

    @Nested
    @DisplayName("Session ledger")
    class Session {

        @Test
        @DisplayName("Floor raises the tier of a harmless task")
        void floorApplies() {
            var ledger = new RiskLedger();
            var descriptor = new TaskDescriptor("fix typo", List.of(), COMPLETE);
            assertEquals(RiskTier.T2, classifier.classify(descriptor, ledger, RiskTier.T2));
        }

        @Test
        @DisplayName("A task is never downgraded within a session")
        void neverDowngraded() {
            var ledger = new RiskLedger();
            var descriptor = new TaskDescriptor("fix typo", List.of("docs/a.md"), COMPLETE);
            assertEquals(RiskTier.T3, classifier.classify(descriptor, ledger, RiskTier.T3));
            assertEquals(RiskTier.T3, classifier.classify(descriptor, ledger, RiskTier.T0));
        }
    }
}
