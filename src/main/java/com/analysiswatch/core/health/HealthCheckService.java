package com.analysiswatch.core.health;

import com.analysiswatch.core.engine.TaskStatusEngine;
import com.analysiswatch.core.model.SessionStatus;
import com.analysiswatch.core.session.SessionGate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final SessionGate sessionGate;
    private final TaskStatusEngine engine;

    public HealthCheckService(SessionGate sessionGate, TaskStatusEngine engine) {
        this.sessionGate = sessionGate;
        this.engine = engine;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkSession());
        results.add(checkStream());
        results.add(checkEngine());
        return results;
    }

    private HealthStatus checkSession() {
        SessionStatus status = sessionGate.check();
        return switch (status) {
            case AUTHORIZED -> new HealthStatus("session", HealthStatus.Status.UP,
                    "Identity probe accepted the session", Map.of());
            case UNAUTHORIZED -> new HealthStatus("session", HealthStatus.Status.DOWN,
                    "Identity probe rejected the session", Map.of());
            case UNKNOWN -> new HealthStatus("session", HealthStatus.Status.DOWN,
                    "Backend unreachable", Map.of());
        };
    }

    private HealthStatus checkStream() {
        if (engine.isStreamConnected()) {
            return new HealthStatus("stream", HealthStatus.Status.UP,
                    "Event stream connected", Map.of());
        }
        if (engine.isActive()) {
            return new HealthStatus("stream", HealthStatus.Status.DEGRADED,
                    "Event stream disconnected; job list may be stale", Map.of());
        }
        return new HealthStatus("stream", HealthStatus.Status.DOWN,
                "Event stream not connected", Map.of());
    }

    private HealthStatus checkEngine() {
        if (!engine.isActive()) {
            return new HealthStatus("engine", HealthStatus.Status.DEGRADED,
                    "No active session", Map.of());
        }
        return new HealthStatus("engine", HealthStatus.Status.UP,
                "Tracking " + engine.currentJobs().size() + " active analyses",
                Map.of("generation", String.valueOf(engine.generation())));
    }
}
