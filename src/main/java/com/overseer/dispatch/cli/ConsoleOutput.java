package com.overseer.dispatch.cli;

import com.overseer.core.model.PhaseStatus;
import com.overseer.core.model.WorkflowReport;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Overseer CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "----------------------------------";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(yellow) OVERSEER v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [OVERSEER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
    }

    public static void phase(String name, PhaseStatus status) {
        String color = switch (status) {
            case COMPLETED -> "fg(green)";
            case FAILED -> "fg(red)";
            case IN_PROGRESS -> "fg(yellow)";
            default -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format("  @|%s %-11s|@ %s", color, status, name)));
    }

    public static void resource(String path) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(green) ~|@ " + path));
    }

    public static void report(WorkflowReport report) {
        System.out.println();
        System.out.println("WORKFLOW " + report.requestId());
        if (report.workflowClass() != null) {
            System.out.println("Class: " + report.workflowClass() + " | Tier: " + report.tier());
        }
        if (!report.phases().isEmpty()) {
            System.out.println("PHASES:");
            for (Map.Entry<String, PhaseStatus> entry : report.phases().entrySet()) {
                phase(entry.getKey(), entry.getValue());
            }
        }
        if (!report.modifiedResources().isEmpty()) {
            System.out.println("MODIFIED:");
            report.modifiedResources().forEach(ConsoleOutput::resource);
        }
        report.incidents().forEach(i -> info("incident: " + i));
        report.warnings().forEach(ConsoleOutput::warn);
        report.errors().forEach(ConsoleOutput::error);
        System.out.println(RULE);
        System.out.println("Status: " + report.status() + " (" + formatDuration(report.elapsedMs()) + ")");
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
