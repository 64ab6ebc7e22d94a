package com.webdoc.core.stage;

import com.webdoc.core.model.FailureReason;
import com.webdoc.core.model.Topic;

import java.util.List;

/**
 * Terminal outcome of the idea stage.
 *
 * @param topics        decoded topics; empty unless succeeded
 * @param failureReason set when the stage failed
 * @param detail        diagnostic for a failure
 * @param cancelled     the run was cancelled before producing topics
 */
public record IdeaStageResult(List<Topic> topics, FailureReason failureReason, String detail, boolean cancelled) {

    public static IdeaStageResult succeeded(List<Topic> topics) {
        return new IdeaStageResult(List.copyOf(topics), null, null, false);
    }

    public static IdeaStageResult failed(FailureReason reason, String detail) {
        return new IdeaStageResult(List.of(), reason, detail, false);
    }

    public static IdeaStageResult cancelledRun() {
        return new IdeaStageResult(List.of(), null, null, true);
    }

    public boolean succeeded() {
        return failureReason == null && !cancelled;
    }
}
