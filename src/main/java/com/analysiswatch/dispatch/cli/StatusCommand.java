package com.analysiswatch.dispatch.cli;

import com.analysiswatch.core.model.SessionStatus;
import com.analysiswatch.core.session.SessionGate;
import com.analysiswatch.core.snapshot.SnapshotLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: analysiswatch status
 * <p>
 * Probes the identity endpoint and, when the session is authorized, prints the
 * backend's current queued and running analyses. Does not open the event stream.
 */
@Command(name = "status", mixinStandardHelpOptions = true,
        description = "Show analyses currently queued or running")
@Component
public class StatusCommand implements Callable<Integer> {

    private final SessionGate sessionGate;
    private final SnapshotLoader snapshotLoader;

    public StatusCommand(SessionGate sessionGate, SnapshotLoader snapshotLoader) {
        this.sessionGate = sessionGate;
        this.snapshotLoader = snapshotLoader;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        SessionStatus status = sessionGate.check();
        if (status == SessionStatus.UNAUTHORIZED) {
            ConsoleOutput.error("Not signed in: the backend rejected the configured access token");
            return 2;
        }
        if (status == SessionStatus.UNKNOWN) {
            ConsoleOutput.error("Backend unreachable");
            return 1;
        }

        ConsoleOutput.jobs(snapshotLoader.loadSnapshot());
        return 0;
    }
}
