package com.overseer.dispatch.cli;

import com.overseer.core.classifier.RequestClassifier;
import com.overseer.core.model.ClassificationResult;
import com.overseer.core.model.Dimension;
import com.overseer.core.model.Request;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CLI command: overseer classify "&lt;request&gt;"
 * <p>
 * Prints the score, tier and plan a request would get without running it.
 */
@Command(name = "classify", mixinStandardHelpOptions = true, description = "Classify a request without running it")
@Component
public class ClassifyCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language request")
    private String request;

    @Option(names = {"--file", "-f"}, description = "Resource the request touches (repeatable)")
    private List<String> files = new ArrayList<>();

    @Mixin
    private RiskAnswerOptions riskAnswers = new RiskAnswerOptions();

    private final RequestClassifier classifier;

    public ClassifyCommand(RequestClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ClassificationResult result;
        try {
            result = classifier.classify(Request.of(request, files).withRiskAnswers(riskAnswers.toAnswers()));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        for (Dimension dimension : Dimension.values()) {
            Double value = result.score().values().get(dimension);
            System.out.printf("  %-14s %s%n", dimension.name().toLowerCase(),
                    value != null ? String.format("%.1f", value) : "unscorable");
        }
        System.out.printf("  %-14s %.2f%n", "aggregate", result.score().aggregate());
        ConsoleOutput.info("Class: " + result.workflowClass() + " | Tier: " + result.tier()
                + (result.plan().conservative() ? " | conservative plan" : ""));
        ConsoleOutput.info("Phases: " + result.plan().phases().stream()
                .map(p -> p.name() + "(" + p.verification() + ")")
                .collect(Collectors.joining(" -> ")));
        ConsoleOutput.info("Rule: " + result.rationale().rule() + " (confidence "
                + String.format("%.2f", result.rationale().confidence()) + ", "
                + result.rationale().confidenceLevel() + ")");
        if (!result.rationale().factors().isEmpty()) {
            ConsoleOutput.info("Factors: " + String.join(", ", result.rationale().factors()));
        }
        result.rationale().runnerUp().ifPresent(alt -> ConsoleOutput.info("Runner-up: "
                + alt.workflowClass() + " via " + alt.rule()));
    }
}
