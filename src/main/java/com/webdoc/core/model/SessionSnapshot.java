package com.webdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of the session at one instant, used for status queries and for the
 * snapshot frame delivered to late-joining observers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionSnapshot(
    @JsonProperty("session_id") String sessionId,
    SessionStage stage,
    @JsonIgnore PipelineConfig config,
    List<Topic> topics,
    List<Integer> selection,
    List<DocumentResult> results,
    @JsonProperty("latest_progress") ProgressEvent latestProgress,
    @JsonProperty("failure_reason") FailureReason failureReason,
    @JsonProperty("error_detail") String errorDetail,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("ended_at") Instant endedAt,
    @JsonProperty("cancel_requested") boolean cancelRequested
) {

    public static SessionSnapshot idle() {
        return new SessionSnapshot(null, SessionStage.IDLE, null, List.of(), List.of(), List.of(),
                null, null, null, null, null, false);
    }

    @JsonProperty("pipeline_name")
    public String pipelineName() {
        return config != null ? config.name() : null;
    }

    public List<Topic> selectedTopics() {
        return selection.stream()
                .map(id -> topics.get(id))
                .toList();
    }
}
