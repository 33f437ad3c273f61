package com.overseer.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: run, classify, health.
 */
@Command(
        name = "overseer",
        mixinStandardHelpOptions = true,
        version = "Overseer 0.1.0",
        description = "Multi-agent workflow orchestration engine",
        subcommands = {
                RunCommand.class,
                ClassifyCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class OverseerCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
