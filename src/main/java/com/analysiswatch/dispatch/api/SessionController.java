package com.analysiswatch.dispatch.api;

import com.analysiswatch.core.engine.TaskStatusEngine;
import com.analysiswatch.core.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * REST controller for the engine's session lifecycle.
 */
@RestController
@RequestMapping("/api/v1/session")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private static final long ACTIVATION_TIMEOUT_SECONDS = 30;

    private final TaskStatusEngine engine;

    public SessionController(TaskStatusEngine engine) {
        this.engine = engine;
    }

    /**
     * POST /api/v1/session: Activate the engine.
     * 202 when the session is active, 401 when the identity probe rejects it,
     * 503 when the backend cannot be reached.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> activate() {
        SessionStatus status;
        try {
            status = engine.activate().get(ACTIVATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Activation interrupted"));
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Activation did not complete: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Activation did not complete"));
        }

        return switch (status) {
            case AUTHORIZED -> ResponseEntity.accepted()
                    .body(Map.of("status", status.name(), "generation", engine.generation()));
            case UNAUTHORIZED -> ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("status", status.name()));
            case UNKNOWN -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("status", status.name()));
        };
    }

    /**
     * DELETE /api/v1/session: Tear the session down (logout).
     */
    @DeleteMapping
    public ResponseEntity<Void> teardown() {
        engine.teardown();
        return ResponseEntity.noContent().build();
    }
}
