package com.analysiswatch.dispatch.api;

import com.analysiswatch.core.engine.TaskStatusEngine;
import com.analysiswatch.core.model.AnalysisNotification;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller exposing the live analysis job list.
 */
@RestController
@RequestMapping("/api/v1/analyses")
public class AnalysisController {

    private final TaskStatusEngine engine;
    private final SseStreamingService sseStreamingService;

    public AnalysisController(TaskStatusEngine engine, SseStreamingService sseStreamingService) {
        this.engine = engine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /api/v1/analyses: Jobs currently queued or running.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> currentJobs() {
        var jobs = engine.currentJobs();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("active", engine.isActive());
        result.put("stream_connected", engine.isStreamConnected());
        result.put("count", jobs.size());
        result.put("jobs", jobs.stream().map(SseStreamingService::toMap).toList());
        return ResponseEntity.ok(result);
    }

    /**
     * GET /api/v1/analyses/notifications: Notifications that have not expired yet.
     */
    @GetMapping("/notifications")
    public ResponseEntity<List<AnalysisNotification>> notifications() {
        return ResponseEntity.ok(engine.activeNotifications());
    }

    /**
     * GET /api/v1/analyses/events: SSE stream of job list changes and notifications.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return sseStreamingService.createEmitter();
    }
}
