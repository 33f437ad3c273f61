package com.overseer.dispatch.cli;

import com.overseer.core.classifier.ClassificationRules;
import com.overseer.core.classifier.RequestClassifier;
import com.overseer.core.engine.Orchestrator;
import com.overseer.core.health.HealthCheckService;
import com.overseer.core.health.HealthStatus;
import com.overseer.core.model.PhaseStatus;
import com.overseer.core.model.Request;
import com.overseer.core.model.RiskTier;
import com.overseer.core.model.WorkflowClass;
import com.overseer.core.model.WorkflowReport;
import com.overseer.core.model.WorkflowStatus;
import com.overseer.core.risk.RiskClassifier;
import com.overseer.core.risk.RiskRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Exercises the picocli command tree directly, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private Orchestrator orchestrator;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        orchestrator = mock(Orchestrator.class);
        healthCheckService = mock(HealthCheckService.class);
    }

    private static WorkflowReport report(WorkflowStatus status, Map<String, PhaseStatus> phases, List<String> errors) {
        return new WorkflowReport("OVSR-2026-0001", status, WorkflowClass.STANDARD, RiskTier.T1, phases,
                List.of("src/api/Client.java"), errors, List.of(), List.of(), 1250L);
    }

    private CommandLine.IFactory factory() {
        var classifier = new RequestClassifier(ClassificationRules.defaults(), new RiskClassifier(RiskRules.defaults()));
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(orchestrator);
                }
                if (cls == ClassifyCommand.class) {
                    return (K) new ClassifyCommand(classifier);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(capture, true));
        try {
            var cmd = new CommandLine(new OverseerCommand(), factory());
            int exitCode = cmd.execute(args);
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
        }
    }

    @Test
    @DisplayName("No arguments prints the banner and the subcommands")
    void usage() {
        CliResult result = execute();

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("OVERSEER v0.1.0"));
        assertTrue(result.output().contains("run"));
        assertTrue(result.output().contains("classify"));
        assertTrue(result.output().contains("health"));
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("A completed workflow exits 0 and prints the report")
        void completed() {
            when(orchestrator.run(any(Request.class))).thenReturn(report(WorkflowStatus.ALL_PHASES_COMPLETED,
                    Map.of("implement", PhaseStatus.COMPLETED), List.of()));

            CliResult result = execute("run", "Add retry to the API client", "-f", "src/api/Client.java");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("WORKFLOW OVSR-2026-0001"));
            assertTrue(result.output().contains("src/api/Client.java"));
            assertTrue(result.output().contains("Status: ALL_PHASES_COMPLETED (1s)"));
            assertTrue(result.output().contains("Workflow complete."));
        }

        @Test
        @DisplayName("Files, patterns and risk answers reach the request")
        void optionsReachRequest() {
            when(orchestrator.run(any(Request.class))).thenReturn(report(WorkflowStatus.ALL_PHASES_COMPLETED,
                    Map.of(), List.of()));

            execute("run", "rotate credentials", "--file", "config/credentials.yml", "--pattern", "rotation",
                    "--failure-scenario", "clients lose access", "--detection-signal", "401 rate",
                    "--rollback", "git revert", "--weakest-assumption", "no cached tokens");

            var captor = ArgumentCaptor.forClass(Request.class);
            verify(orchestrator).run(captor.capture());
            Request request = captor.getValue();
            assertEquals(List.of("config/credentials.yml"), request.fileHints());
            assertEquals(List.of("rotation"), request.context().priorPatterns());
            assertEquals("git revert", request.riskAnswers().fastestRollback());
            assertTrue(request.riskAnswers().complete());
        }

        @Test
        @DisplayName("Awaiting confirmation exits 2 unless --confirm is given")
        void awaitingConfirmation() {
            var awaiting = report(WorkflowStatus.AWAITING_CONFIRMATION,
                    Map.of("implement", PhaseStatus.IN_PROGRESS), List.of());
            when(orchestrator.run(any(Request.class))).thenReturn(awaiting);

            CliResult result = execute("run", "rotate credentials");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("--confirm"));
            verify(orchestrator, never()).confirm(any(), any());
        }

        @Test
        @DisplayName("--confirm confirms each waiting phase under the operator name")
        void confirmAll() {
            var awaiting = report(WorkflowStatus.AWAITING_CONFIRMATION,
                    Map.of("implement", PhaseStatus.IN_PROGRESS), List.of());
            var done = report(WorkflowStatus.ALL_PHASES_COMPLETED,
                    Map.of("implement", PhaseStatus.COMPLETED), List.of());
            when(orchestrator.run(any(Request.class))).thenReturn(awaiting);
            when(orchestrator.confirm("OVSR-2026-0001", "alice")).thenReturn(done);

            CliResult result = execute("run", "rotate credentials", "--confirm", "--operator", "alice");

            assertEquals(0, result.exitCode());
            verify(orchestrator).confirm("OVSR-2026-0001", "alice");
        }

        @Test
        @DisplayName("An aborted workflow exits 1 and lists its errors")
        void failed() {
            when(orchestrator.run(any(Request.class))).thenReturn(report(WorkflowStatus.ABORTED_FAILED,
                    Map.of("implement", PhaseStatus.FAILED), List.of("implement-1: tests failed")));

            CliResult result = execute("run", "refactor the client");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("implement-1: tests failed"));
            assertTrue(result.output().contains("Workflow failed."));
        }

        @Test
        @DisplayName("A blank request exits 1 without running anything")
        void blankRequest() {
            CliResult result = execute("run", "   ");

            assertEquals(1, result.exitCode());
            verify(orchestrator, never()).run(any(Request.class));
        }
    }

    @Test
    @DisplayName("classify prints class, tier and phases without running")
    void classify() {
        CliResult result = execute("classify", "fix typo in README", "-f", "README.md");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("Class: DIRECT | Tier: T0"));
        assertTrue(result.output().contains("Phases: execute"));
        assertTrue(result.output().contains("aggregate"));
        assertTrue(result.output().contains("Runner-up: STANDARD via standard"));
        verify(orchestrator, never()).run(any(Request.class));
    }

    @Test
    @DisplayName("health lists every component and the overall verdict")
    void health() {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("graph", HealthStatus.Status.UP, "Graph compiled and available", Map.of()),
                new HealthStatus("hooks", HealthStatus.Status.DEGRADED, "No hooks registered", Map.of())));

        CliResult result = execute("health");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("graph: Graph compiled and available"));
        assertTrue(result.output().contains("hooks: No hooks registered"));
        assertTrue(result.output().contains("one or more components degraded or down"));
    }

    @Test
    @DisplayName("Durations are formatted for humans")
    void formatDuration() {
        assertEquals("850ms", ConsoleOutput.formatDuration(850));
        assertEquals("42s", ConsoleOutput.formatDuration(42_000));
        assertEquals("2m 5s", ConsoleOutput.formatDuration(125_000));
    }
}
