package com.analysiswatch.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AnalysisWatchCommand analysisWatchCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AnalysisWatchCommand analysisWatchCommand, IFactory factory) {
        this.analysisWatchCommand = analysisWatchCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // Serve mode is owned by the embedded web server; picocli would return immediately.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(analysisWatchCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
