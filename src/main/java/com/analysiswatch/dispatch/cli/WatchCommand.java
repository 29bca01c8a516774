package com.analysiswatch.dispatch.cli;

import com.analysiswatch.core.engine.TaskStatusEngine;
import com.analysiswatch.core.events.Subscription;
import com.analysiswatch.core.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: analysiswatch watch
 * <p>
 * Activates the engine and prints the job list after every change, plus completion
 * notifications, until interrupted or until {@code --duration} elapses.
 */
@Command(name = "watch", mixinStandardHelpOptions = true,
        description = "Follow analyses live until interrupted")
@Component
public class WatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WatchCommand.class);

    @Option(names = {"--duration", "-d"},
            description = "Stop after this many seconds (default: run until interrupted)")
    private long durationSeconds;

    private final TaskStatusEngine engine;

    public WatchCommand(TaskStatusEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() throws Exception {
        ConsoleOutput.printBanner();

        Subscription jobs = engine.onJobsChanged(ConsoleOutput::jobs);
        Subscription notifications = engine.onNotification(ConsoleOutput::notification);
        CountDownLatch stop = new CountDownLatch(1);
        Thread hook = new Thread(stop::countDown, "watch-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            SessionStatus status = engine.activate().get();
            if (status != SessionStatus.AUTHORIZED) {
                ConsoleOutput.error("Cannot watch: session is " + status);
                return status == SessionStatus.UNAUTHORIZED ? 2 : 1;
            }
            ConsoleOutput.info("Watching analyses. Press Ctrl+C to stop.");
            if (durationSeconds > 0) {
                stop.await(durationSeconds, TimeUnit.SECONDS);
            } else {
                stop.await();
            }
            return 0;
        } finally {
            jobs.unsubscribe();
            notifications.unsubscribe();
            engine.teardown().get(5, TimeUnit.SECONDS);
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down; shutdown hook stays registered");
            }
        }
    }
}
