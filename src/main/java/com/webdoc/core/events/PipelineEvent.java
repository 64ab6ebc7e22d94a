package com.webdoc.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the orchestration core, used for SSE streaming and CLI watch mode.
 *
 * @param eventType event kind (e.g. "stage_changed", "progress", "document_result")
 * @param sessionId the session this event belongs to (nullable for the idle snapshot)
 * @param topicId   the topic this event relates to (nullable for session-level events)
 * @param payload   key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String sessionId,
    Integer topicId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
