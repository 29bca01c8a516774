package com.analysiswatch.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Analysis Watch.
 * Routes to subcommands: status, watch, health, serve.
 */
@Command(
        name = "analysiswatch",
        mixinStandardHelpOptions = true,
        version = "Analysis Watch 0.1.0",
        description = "Tracks queued and running AI analysis jobs for the signed-in tenant",
        subcommands = {
                StatusCommand.class,
                WatchCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AnalysisWatchCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
