package com.webdoc.core.state;

import com.webdoc.core.model.DocumentResult;
import com.webdoc.core.model.FailureReason;
import com.webdoc.core.model.PipelineConfig;
import com.webdoc.core.model.ProgressEvent;
import com.webdoc.core.model.SessionSnapshot;
import com.webdoc.core.model.SessionStage;
import com.webdoc.core.model.Topic;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The single mutable session root. Only {@link SessionStateMachine} touches instances,
 * always under its lock.
 */
final class Session {

    final String id;
    final PipelineConfig config;
    final Instant startedAt;
    SessionStage stage = SessionStage.RUNNING_IDEAS;
    List<Topic> topics = List.of();
    List<Integer> selection = List.of();
    final List<DocumentResult> results = new ArrayList<>();
    final Map<String, ProgressEvent> latestProgress = new HashMap<>();
    String currentStageName = ProgressEvent.IDEAS;
    FailureReason failureReason;
    String errorDetail;
    Instant endedAt;
    boolean cancelRequested;

    Session(String id, PipelineConfig config, Instant startedAt) {
        this.id = id;
        this.config = config;
        this.startedAt = startedAt;
    }

    int currentPercent(String stageName) {
        ProgressEvent latest = latestProgress.get(stageName);
        return latest == null ? 0 : latest.percent();
    }

    SessionSnapshot snapshot() {
        return new SessionSnapshot(id, stage, config, List.copyOf(topics), List.copyOf(selection),
                List.copyOf(results), latestProgress.get(currentStageName), failureReason, errorDetail,
                startedAt, endedAt, cancelRequested);
    }
}
