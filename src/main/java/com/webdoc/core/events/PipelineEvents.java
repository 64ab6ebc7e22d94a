package com.webdoc.core.events;

import com.webdoc.core.model.DocumentResult;
import com.webdoc.core.model.FailureReason;
import com.webdoc.core.model.ProgressEvent;
import com.webdoc.core.model.SessionSnapshot;
import com.webdoc.core.model.SessionStage;
import com.webdoc.core.model.Topic;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for the event kinds carried on the observer stream.
 */
public final class PipelineEvents {

    public static final String SNAPSHOT = "snapshot";
    public static final String STAGE_CHANGED = "stage_changed";
    public static final String PROGRESS = "progress";
    public static final String TOPICS_READY = "topics_ready";
    public static final String DOCUMENT_RESULT = "document_result";
    public static final String PIPELINE_FINISHED = "pipeline_finished";
    public static final String ERROR = "error";

    private PipelineEvents() {}

    public static PipelineEvent stageChanged(String sessionId, SessionStage stage) {
        return new PipelineEvent(STAGE_CHANGED, sessionId, null,
                Map.of("stage", stage.wireName()), Instant.now());
    }

    public static PipelineEvent progress(String sessionId, ProgressEvent progress) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("stage", progress.stageName());
        payload.put("percent", progress.percent());
        payload.put("message", progress.message());
        payload.put("kind", progress.kind().wireName());
        return new PipelineEvent(PROGRESS, sessionId, null, payload, progress.timestamp());
    }

    public static PipelineEvent topicsReady(String sessionId, List<Topic> topics) {
        return new PipelineEvent(TOPICS_READY, sessionId, null,
                Map.of("topics", topics, "count", topics.size()), Instant.now());
    }

    public static PipelineEvent documentResult(String sessionId, DocumentResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("topic_id", result.topicId());
        payload.put("status", result.status().wireName());
        payload.put("attempts", result.attempts());
        if (result.outputLocation() != null) {
            payload.put("output_location", result.outputLocation());
        }
        if (result.errorDetail() != null) {
            payload.put("error_detail", result.errorDetail());
        }
        return new PipelineEvent(DOCUMENT_RESULT, sessionId, result.topicId(), payload, Instant.now());
    }

    public static PipelineEvent pipelineFinished(SessionSnapshot snapshot) {
        List<DocumentResult> results = snapshot.results();
        long succeeded = results.stream().filter(DocumentResult::succeeded).count();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("stage", snapshot.stage().wireName());
        summary.put("selected", snapshot.selection().size());
        summary.put("succeeded", succeeded);
        summary.put("failed", results.size() - succeeded);
        if (snapshot.startedAt() != null && snapshot.endedAt() != null) {
            summary.put("duration_ms", Duration.between(snapshot.startedAt(), snapshot.endedAt()).toMillis());
        }
        if (snapshot.failureReason() != null) {
            summary.put("failure_reason", snapshot.failureReason().wireName());
        }
        return new PipelineEvent(PIPELINE_FINISHED, snapshot.sessionId(), null,
                Map.of("summary", summary), Instant.now());
    }

    public static PipelineEvent error(String sessionId, FailureReason reason, String detail) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reason", reason.wireName());
        payload.put("detail", detail != null ? detail : "");
        return new PipelineEvent(ERROR, sessionId, null, payload, Instant.now());
    }

    /**
     * Synthesized state frame for an observer joining mid-pipeline. Topics are included
     * whenever the session has them, so a client landing in awaiting_selection can render
     * the selection list immediately.
     */
    public static PipelineEvent snapshot(SessionSnapshot snapshot) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("stage", snapshot.stage().wireName());
        if (snapshot.config() != null) {
            payload.put("pipeline_name", snapshot.config().name());
        }
        if (snapshot.latestProgress() != null) {
            ProgressEvent p = snapshot.latestProgress();
            payload.put("progress", Map.of(
                    "stage", p.stageName(),
                    "percent", p.percent(),
                    "message", p.message()));
        }
        if (!snapshot.topics().isEmpty()) {
            payload.put("topics", snapshot.topics());
        }
        if (!snapshot.selection().isEmpty()) {
            payload.put("selection", snapshot.selection());
        }
        if (!snapshot.results().isEmpty()) {
            payload.put("results", snapshot.results());
        }
        if (snapshot.failureReason() != null) {
            payload.put("failure_reason", snapshot.failureReason().wireName());
            payload.put("error_detail", snapshot.errorDetail() != null ? snapshot.errorDetail() : "");
        }
        return new PipelineEvent(SNAPSHOT, snapshot.sessionId(), null, payload, Instant.now());
    }
}
