package com.analysiswatch.core.snapshot;

import com.analysiswatch.backend.ApiResponse;
import com.analysiswatch.backend.BackendApiClient;
import com.analysiswatch.backend.BackendApiException;
import com.analysiswatch.core.metrics.AnalysisWatchMetrics;
import com.analysiswatch.core.model.JobPhase;
import com.analysiswatch.core.model.JobRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches the queued and running analysis jobs visible to the session.
 * <p>
 * Never throws: fetch errors and non-2xx responses yield an empty list. 401/403 are
 * absorbed silently since the user may simply be logged out.
 */
public class SnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotLoader.class);

    private final BackendApiClient client;
    private final String statusPath;
    private final Clock clock;
    private final AnalysisWatchMetrics metrics;

    public SnapshotLoader(BackendApiClient client, String statusPath, Clock clock, AnalysisWatchMetrics metrics) {
        this.client = client;
        this.statusPath = statusPath;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Loads the current snapshot.
     *
     * @return running rows as {@link JobPhase#RUNNING}, then queued rows as {@link JobPhase#QUEUED}
     */
    public List<JobRecord> loadSnapshot() {
        Instant requestedAt = clock.instant();
        ApiResponse response;
        try {
            response = client.get(statusPath);
        } catch (BackendApiException e) {
            log.warn("Snapshot fetch failed: {}", e.getMessage());
            metrics.recordSnapshotLoad("failed");
            return List.of();
        }

        if (response.isAuthFailure()) {
            log.debug("Snapshot fetch returned HTTP {}; skipping", response.statusCode());
            metrics.recordSnapshotLoad("unauthorized");
            return List.of();
        }
        if (!response.isSuccess()) {
            log.warn("Snapshot fetch returned HTTP {}; treating as empty", response.statusCode());
            metrics.recordSnapshotLoad("failed");
            return List.of();
        }

        List<JobRecord> records = parse(response.body(), requestedAt);
        metrics.recordSnapshotLoad("loaded");
        log.info("Snapshot loaded: {} active analyses", records.size());
        return records;
    }

    List<JobRecord> parse(JsonNode body, Instant observedAt) {
        List<JobRecord> records = new ArrayList<>();
        collect(body.path("running"), JobPhase.RUNNING, observedAt, records);
        collect(body.path("queued"), JobPhase.QUEUED, observedAt, records);
        return records;
    }

    private void collect(JsonNode rows, JobPhase phase, Instant observedAt, List<JobRecord> into) {
        if (!rows.isArray()) {
            return;
        }
        for (JsonNode row : rows) {
            String entityId = text(row, "customer_id");
            if (entityId == null) {
                log.warn("Dropping {} snapshot row without customer_id: {}", phase, row);
                continue;
            }
            into.add(new JobRecord(entityId, text(row, "company_name"), text(row, "task_id"), phase, observedAt));
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
