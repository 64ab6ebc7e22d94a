package com.webdoc.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing WebDoc-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setStage(String sessionId, String stage) {
        MDC.put("sessionId", sessionId);
        MDC.put("stage", stage);
    }

    public static void setTopic(int topicId) {
        MDC.put("topicId", String.valueOf(topicId));
    }

    public static void clearTopic() {
        MDC.remove("topicId");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("stage");
        MDC.remove("topicId");
    }
}
