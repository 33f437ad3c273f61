package com.overseer.dispatch.cli;

import com.overseer.core.engine.Orchestrator;
import com.overseer.core.model.Request;
import com.overseer.core.model.SessionContext;
import com.overseer.core.model.WorkflowReport;
import com.overseer.core.model.WorkflowStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: overseer run "&lt;request&gt;"
 * <p>
 * Classifies the request, runs its workflow and prints the final report. Phases that contain a
 * T3 task stop for confirmation unless {@code --confirm} is given.
 * Exit codes: 0 completed, 1 failed, 2 awaiting confirmation or held.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a request through its workflow")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language request")
    private String request;

    @Option(names = {"--file", "-f"}, description = "Resource the request touches (repeatable)")
    private List<String> files = new ArrayList<>();

    @Option(names = "--pattern", description = "Pattern already seen in this session (repeatable)")
    private List<String> patterns = new ArrayList<>();

    @Option(names = "--confirm", description = "Confirm every phase that requires a human confirmation")
    private boolean confirm;

    @Option(names = "--operator", description = "Name recorded with confirmations", defaultValue = "cli")
    private String operator;

    @Mixin
    private RiskAnswerOptions riskAnswers = new RiskAnswerOptions();

    private final Orchestrator orchestrator;

    public RunCommand(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Request input;
        try {
            input = new Request(request, files, new SessionContext(patterns, List.of(), 0, 0),
                    riskAnswers.toAnswers());
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.info("Classifying request...");
        WorkflowReport report;
        try {
            report = orchestrator.run(input);
            while (report.awaitingConfirmation() && confirm) {
                ConsoleOutput.info("Confirming phase as " + operator);
                report = orchestrator.confirm(report.requestId(), operator);
            }
        } catch (RuntimeException e) {
            ConsoleOutput.error("Workflow failed: " + rootCauseMessage(e));
            return 1;
        }

        ConsoleOutput.report(report);
        if (report.status() == WorkflowStatus.ALL_PHASES_COMPLETED) {
            ConsoleOutput.success("Workflow complete.");
            return 0;
        }
        if (report.awaitingConfirmation()) {
            ConsoleOutput.warn("A phase contains a T3 task. Re-run with --confirm to approve it.");
            return 2;
        }
        if (report.status() == WorkflowStatus.COMPLETION_HELD) {
            ConsoleOutput.warn("Completion held by a stop hook.");
            return 2;
        }
        ConsoleOutput.error("Workflow failed.");
        return 1;
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
