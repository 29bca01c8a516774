package com.analysiswatch.dispatch.cli;

import com.analysiswatch.core.engine.TaskStatusEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: analysiswatch serve
 * <p>
 * Runs Analysis Watch as a long-running HTTP server exposing the REST API and SSE
 * stream. The web server is enabled by {@link com.analysiswatch.AnalysisWatchApplication#main}
 * detecting "serve" in args; {@link CliRunner} then skips picocli. Once the server is
 * ready the engine is activated; an unauthorized session leaves it idle until
 * {@code POST /api/v1/session}.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Analysis Watch HTTP server")
@Component
public class ServeCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    @Value("${server.port:8080}")
    private int port;

    private final TaskStatusEngine engine;

    public ServeCommand(TaskStatusEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        // Only reached via --help style invocations; CliRunner skips picocli in serve mode.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
        engine.activate().whenComplete((status, ex) -> {
            if (ex != null) {
                log.warn("Initial activation failed: {}", ex.getMessage(), ex);
            } else {
                log.info("Initial activation finished: {}", status);
            }
        });
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Analysis Watch server running on port " + port);
        System.out.println();
        System.out.println("  Jobs:    http://localhost:" + port + "/api/v1/analyses");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/analyses/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
